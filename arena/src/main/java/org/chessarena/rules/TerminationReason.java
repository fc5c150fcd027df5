package org.chessarena.rules;

public enum TerminationReason {
    CHECKMATE,
    STALEMATE,
    INSUFFICIENT_MATERIAL,
    THREEFOLD_REPETITION,
    FIFTY_MOVE_RULE,
    DIRECTOR_DECISION;

    public String displayName() {
        return name().toLowerCase().replace('_', ' ');
    }
}
