package org.chessarena.match;

import org.chessarena.model.PieceColor;
import org.chessarena.model.Position;
import org.chessarena.rules.MatchResult;

import java.util.List;

/**
 * Immutable read view of a match at one instant.
 *
 * @param result       set only when the status is {@link MatchStatus#GAME_OVER}
 * @param errorMessage set only when the status is {@link MatchStatus#ERROR}
 */
public record MatchSnapshot(Position position,
                            MatchStatus status,
                            MatchResult result,
                            String errorMessage,
                            int whiteHallucinations,
                            int blackHallucinations,
                            int hallucinationCeiling,
                            AgentUsage whiteUsage,
                            AgentUsage blackUsage,
                            List<MoveRecord> moves) {

    public String fen() {
        return position.toFen();
    }

    public PieceColor sideToMove() {
        return position.sideToMove();
    }

    public int hallucinations(PieceColor side) {
        return side == PieceColor.WHITE ? whiteHallucinations : blackHallucinations;
    }

    public AgentUsage usage(PieceColor side) {
        return side == PieceColor.WHITE ? whiteUsage : blackUsage;
    }
}
