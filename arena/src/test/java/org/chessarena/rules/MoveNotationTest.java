package org.chessarena.rules;

import org.chessarena.model.CastleSide;
import org.chessarena.model.PieceType;
import org.chessarena.model.Square;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class MoveNotationTest {

    @Test
    void pieceMoveWithFileHintAndCapture() {
        MoveNotation notation = MoveNotation.parse("Nbxd7+");

        assertEquals(PieceType.KNIGHT, notation.piece());
        assertTrue(notation.pieceExplicit());
        assertTrue(notation.capture());
        assertEquals(1, notation.fromCol());
        assertEquals(-1, notation.fromRow());
        assertEquals(Square.parse("d7"), notation.target());
        assertEquals("the b-file", notation.describeSource());
    }

    @Test
    void pawnPromotionWithAndWithoutEqualsSign() {
        assertEquals(PieceType.QUEEN, MoveNotation.parse("e8=Q").promotion());
        assertEquals(PieceType.KNIGHT, MoveNotation.parse("exd8n").promotion());
        assertEquals(PieceType.PAWN, MoveNotation.parse("e8=Q").piece());
    }

    @Test
    void coordinateNotationHasFullSource() {
        MoveNotation notation = MoveNotation.parse("g1f3");

        assertTrue(notation.hasFullSource());
        assertFalse(notation.pieceExplicit());
        assertEquals("g1", notation.describeSource());
        assertTrue(notation.matchesSource(Square.parse("g1")));
        assertFalse(notation.matchesSource(Square.parse("b1")));
    }

    @Test
    void castlingAcceptsLettersAndZeros() {
        assertEquals(CastleSide.KINGSIDE, MoveNotation.parse("O-O").castleSide());
        assertEquals(CastleSide.QUEENSIDE, MoveNotation.parse("0-0-0").castleSide());
        assertEquals(CastleSide.KINGSIDE, MoveNotation.parse("O-O+").castleSide());
    }

    @Test
    void lowercasePieceLettersExceptBishop() {
        assertEquals(PieceType.KNIGHT, MoveNotation.parse("nf3").piece());
        assertEquals(PieceType.ROOK, MoveNotation.parse("rxa8").piece());
        assertEquals(PieceType.KING, MoveNotation.parse("ke2").piece());

        MoveNotation pawn = MoveNotation.parse("bxc3");
        assertEquals(PieceType.PAWN, pawn.piece());
        assertEquals(1, pawn.fromCol());
    }

    @Test
    void rankHintIsDescribed() {
        assertEquals("rank 2", MoveNotation.parse("R2a5").describeSource());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "Knight f3", "Zf3", "e9", "Ni9", "resign"})
    void nonMovesAreNotParsed(String text) {
        assertNull(MoveNotation.parse(text));
    }
}
