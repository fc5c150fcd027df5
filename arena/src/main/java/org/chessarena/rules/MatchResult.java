package org.chessarena.rules;

import java.util.Objects;

public record MatchResult(Outcome outcome, TerminationReason reason) {

    public MatchResult {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(reason, "reason");
    }

    @Override
    public String toString() {
        return outcome.displayName() + " by " + reason.displayName();
    }
}
