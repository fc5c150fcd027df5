package org.chessarena.match;

import org.chessarena.model.PieceColor;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HallucinationCounterTest {

    @Test
    void countsPerSideUntilCeiling() {
        HallucinationCounter counter = new HallucinationCounter(2);

        assertEquals(1, counter.increment(PieceColor.WHITE));
        assertFalse(counter.reachedCeiling(PieceColor.WHITE));
        assertEquals(2, counter.increment(PieceColor.WHITE));
        assertTrue(counter.reachedCeiling(PieceColor.WHITE));
        assertEquals(0, counter.count(PieceColor.BLACK));
    }

    @Test
    void resetClearsOnlyOneSide() {
        HallucinationCounter counter = new HallucinationCounter(3);
        counter.increment(PieceColor.WHITE);
        counter.increment(PieceColor.BLACK);

        counter.reset(PieceColor.WHITE);

        assertEquals(0, counter.count(PieceColor.WHITE));
        assertEquals(1, counter.count(PieceColor.BLACK));

        counter.resetAll();
        assertEquals(0, counter.count(PieceColor.BLACK));
    }

    @Test
    void ceilingMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new HallucinationCounter(0));
    }
}
