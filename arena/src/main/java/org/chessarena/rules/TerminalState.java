package org.chessarena.rules;

public record TerminalState(boolean over, MatchResult result) {

    private static final TerminalState ONGOING = new TerminalState(false, null);

    public static TerminalState ongoing() {
        return ONGOING;
    }

    public static TerminalState of(Outcome outcome, TerminationReason reason) {
        return new TerminalState(true, new MatchResult(outcome, reason));
    }
}
