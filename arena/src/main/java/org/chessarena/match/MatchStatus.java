package org.chessarena.match;

public enum MatchStatus {
    IDLE,
    RUNNING,
    PAUSED,
    WAITING_FOR_DIRECTOR,
    ERROR,
    GAME_OVER;

    public String displayName() {
        return switch (this) {
            case IDLE -> "Idle";
            case RUNNING -> "Running";
            case PAUSED -> "Paused";
            case WAITING_FOR_DIRECTOR -> "Waiting for director";
            case ERROR -> "Error";
            case GAME_OVER -> "Game over";
        };
    }
}
