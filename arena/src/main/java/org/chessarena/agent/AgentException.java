package org.chessarena.agent;

/**
 * Failure of an agent to produce any reply: transport errors, provider
 * errors and engines that return nothing.
 */
public class AgentException extends Exception {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
