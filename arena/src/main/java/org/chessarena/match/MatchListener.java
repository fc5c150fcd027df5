package org.chessarena.match;

import org.chessarena.model.Position;
import org.chessarena.rules.MatchResult;

/**
 * Observer for views and telemetry. Callbacks run on the thread that changed
 * the match and must not block.
 */
public interface MatchListener {

    default void onStatusChanged(MatchStatus previous, MatchStatus current) {
    }

    default void onPositionChanged(Position position) {
    }

    default void onLogEntry(LogEntry entry) {
    }

    default void onMoveApplied(MoveRecord record) {
    }

    default void onAgentActivity(AgentActivity activity) {
    }

    default void onGameOver(MatchResult result) {
    }
}
