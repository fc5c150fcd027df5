package org.chessarena.match;

import org.chessarena.model.PieceColor;
import org.chessarena.model.Position;
import org.chessarena.rules.Outcome;

/**
 * Privileged operations for the human director. Misuse is rejected
 * synchronously and leaves the match untouched.
 */
public interface DirectorControls {

    /**
     * Plays a move for {@code side} in place of its agent. The move is still
     * validated.
     *
     * @throws IllegalArgumentException if the move is illegal or it is not {@code side}'s turn
     * @throws IllegalStateException    if the match is not running, paused or waiting for the director
     */
    void forceMove(String notation, PieceColor side);

    /**
     * Hands the move to the other side without moving a piece.
     *
     * @throws IllegalStateException unless the match is paused or waiting for the director
     */
    void skipTurn();

    /** Replaces the prompt of the next single agent request. */
    void overridePrompt(String text);

    /** Replaces the position without validation. */
    void setPosition(Position position);

    /** Ends the match with the given outcome. */
    void declareResult(Outcome outcome);
}
