package org.chessarena.rules;

import org.chessarena.model.Move;

/**
 * Verdict for a proposed move: either legal with the resolved {@link Move},
 * or illegal with a reason meant to be shown to the agent verbatim.
 */
public record MoveValidation(boolean legal, Move move, String reason) {

    public static MoveValidation legal(Move move) {
        return new MoveValidation(true, move, null);
    }

    public static MoveValidation illegal(String reason) {
        return new MoveValidation(false, null, reason);
    }
}
