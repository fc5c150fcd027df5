package org.chessarena.settings;

import lombok.Data;
import org.chessarena.model.Position;

@Data
public class MatchSettings {
    private int hallucinationCeiling = 2;
    private long turnDelayMs = 1500;
    private long requestTimeoutMs = 60000;
    private String startFen = Position.STANDARD_FEN;
    private boolean defaultPromotionToQueen = true;

    /** Ceiling as used by the orchestrator; values below one are raised to one. */
    public int effectiveCeiling() {
        return Math.max(1, hallucinationCeiling);
    }

    public MatchSettings copy() {
        MatchSettings copy = new MatchSettings();
        copy.setHallucinationCeiling(hallucinationCeiling);
        copy.setTurnDelayMs(turnDelayMs);
        copy.setRequestTimeoutMs(requestTimeoutMs);
        copy.setStartFen(startFen);
        copy.setDefaultPromotionToQueen(defaultPromotionToQueen);
        return copy;
    }
}
