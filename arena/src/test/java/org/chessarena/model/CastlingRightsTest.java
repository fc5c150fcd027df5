package org.chessarena.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CastlingRightsTest {

    @Test
    void removingOneRightKeepsTheOthers() {
        CastlingRights rights = CastlingRights.ALL.without(PieceColor.WHITE, CastleSide.QUEENSIDE);

        assertEquals("Kkq", rights.toFen());
        assertTrue(rights.has(PieceColor.WHITE, CastleSide.KINGSIDE));
        assertFalse(rights.has(PieceColor.WHITE, CastleSide.QUEENSIDE));
    }

    @Test
    void removingAllRightsOfOneColour() {
        assertEquals("KQ", CastlingRights.ALL.without(PieceColor.BLACK).toFen());
        assertEquals("-", CastlingRights.ALL.without(PieceColor.BLACK).without(PieceColor.WHITE).toFen());
    }

    @Test
    void removingAnAbsentRightReturnsSameInstance() {
        assertSame(CastlingRights.NONE, CastlingRights.NONE.without(PieceColor.WHITE, CastleSide.KINGSIDE));
    }
}
