package org.chessarena.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PositionTest {

    @Test
    void standardPositionSerializesToStartFen() {
        assertEquals(Position.STANDARD_FEN, Position.standard().toFen());
        assertEquals(Piece.of(PieceColor.WHITE, PieceType.KING), Position.standard().pieceAt(Square.parse("e1")));
        assertNull(Position.standard().pieceAt(Square.parse("e4")));
    }

    @Test
    void passingTheTurnKeepsTheBoard() {
        Position black = Position.standard().passTurn();

        assertEquals(PieceColor.BLACK, black.sideToMove());
        assertEquals(1, black.fullMoveNumber());
        assertEquals(1, black.halfMoveClock());
        assertEquals(Position.standard().board(), black.board());

        Position white = black.passTurn();
        assertEquals(2, white.fullMoveNumber());
        assertEquals(Position.standard().repetitionKey(), white.repetitionKey());
    }

    @Test
    void rejectsInvalidClocks() {
        assertThrows(IllegalArgumentException.class, () -> new Position(Board.standard(), PieceColor.WHITE,
                CastlingRights.ALL, null, -1, 1));
        assertThrows(IllegalArgumentException.class, () -> new Position(Board.standard(), PieceColor.WHITE,
                CastlingRights.ALL, null, 0, 0));
    }
}
