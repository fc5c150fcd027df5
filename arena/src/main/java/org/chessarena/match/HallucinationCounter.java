package org.chessarena.match;

import org.chessarena.model.PieceColor;

import java.util.EnumMap;
import java.util.Map;

/**
 * Consecutive invalid-move counts per side, compared against a ceiling.
 */
public class HallucinationCounter {
    private final int ceiling;
    private final Map<PieceColor, Integer> counts = new EnumMap<>(PieceColor.class);

    public HallucinationCounter(int ceiling) {
        if (ceiling < 1) {
            throw new IllegalArgumentException("Hallucination ceiling must be at least 1: " + ceiling);
        }
        this.ceiling = ceiling;
    }

    public int increment(PieceColor side) {
        return counts.merge(side, 1, Integer::sum);
    }

    public void reset(PieceColor side) {
        counts.remove(side);
    }

    public void resetAll() {
        counts.clear();
    }

    public int count(PieceColor side) {
        return counts.getOrDefault(side, 0);
    }

    public boolean reachedCeiling(PieceColor side) {
        return count(side) >= ceiling;
    }

    public int getCeiling() {
        return ceiling;
    }
}
