package org.chessarena.match;

import org.chessarena.model.PieceColor;

import java.time.Instant;

/**
 * One line of the match feed.
 *
 * @param side the side the entry concerns, or {@code null} for match-wide entries
 */
public record LogEntry(LogType type, PieceColor side, String content, Instant timestamp) {
}
