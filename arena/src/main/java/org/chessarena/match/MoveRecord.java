package org.chessarena.match;

import org.chessarena.model.Move;
import org.chessarena.model.PieceColor;

/**
 * A move applied to the match, with the commentary the agent attached to it.
 *
 * @param notation the move in standard algebraic notation
 */
public record MoveRecord(int moveNumber,
                         PieceColor side,
                         String notation,
                         Move move,
                         String thought,
                         String trash,
                         Source source) {

    public enum Source {
        AGENT,
        DIRECTOR
    }
}
