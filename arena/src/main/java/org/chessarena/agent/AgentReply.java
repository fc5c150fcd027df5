package org.chessarena.agent;

/**
 * Labelled fields extracted from an agent's free-text reply. Any field may be
 * {@code null} when the reply did not carry it.
 */
public record AgentReply(String move, String thought, String trash, String raw) {

    public boolean hasMove() {
        return move != null && !move.isBlank();
    }
}
