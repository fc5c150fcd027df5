package org.chessarena.match;

public enum LogType {
    SYSTEM,
    TURN,
    MOVE,
    THOUGHT,
    TRASH,
    HALLUCINATION,
    ERROR,
    DIRECTOR
}
