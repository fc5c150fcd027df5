package org.chessarena.match;

import org.chessarena.model.PieceColor;

/**
 * Per-side agent state published after every agent response.
 *
 * @param hallucinations      consecutive invalid moves, compared against the ceiling
 * @param hallucinationTotal  invalid moves over the whole match
 */
public record AgentActivity(PieceColor side,
                            String agentName,
                            AgentUsage usage,
                            int hallucinations,
                            int hallucinationCeiling,
                            int hallucinationTotal) {
}
