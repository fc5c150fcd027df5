package org.chessarena.model;

import org.chessarena.rules.FenCodec;

import java.util.Objects;

/**
 * Canonical position record: board layout, side to move, castling rights,
 * en-passant target, half-move clock and full-move number. Positions are
 * never mutated; every change produces a new instance.
 */
public record Position(Board board,
                       PieceColor sideToMove,
                       CastlingRights castling,
                       Square enPassant,
                       int halfMoveClock,
                       int fullMoveNumber) {

    public static final String STANDARD_FEN = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    public Position {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(sideToMove, "sideToMove");
        Objects.requireNonNull(castling, "castling");
        if (halfMoveClock < 0) {
            throw new IllegalArgumentException("Half-move clock cannot be negative: " + halfMoveClock);
        }
        if (fullMoveNumber < 1) {
            throw new IllegalArgumentException("Full-move number must be at least 1: " + fullMoveNumber);
        }
    }

    public static Position standard() {
        return new Position(Board.standard(), PieceColor.WHITE, CastlingRights.ALL, null, 0, 1);
    }

    public Piece pieceAt(Square square) {
        return board.get(square);
    }

    /**
     * Hands the move to the other side without touching the board. The
     * en-passant target is cleared and the clocks advance as for a quiet move.
     */
    public Position passTurn() {
        int nextFullMove = sideToMove == PieceColor.BLACK ? fullMoveNumber + 1 : fullMoveNumber;
        return new Position(board, sideToMove.opposite(), castling, null, halfMoveClock + 1, nextFullMove);
    }

    /** Identity used for repetition detection; clocks are ignored. */
    public RepetitionKey repetitionKey() {
        return new RepetitionKey(board, sideToMove, castling, enPassant);
    }

    public String toFen() {
        return FenCodec.serialize(this);
    }

    @Override
    public String toString() {
        return toFen();
    }

    public record RepetitionKey(Board board, PieceColor sideToMove, CastlingRights castling, Square enPassant) {
    }
}
