package org.chessarena.agent;

/**
 * Outcome of one engine search: the best move in coordinate notation and a
 * printable evaluation, either of which may be missing.
 */
public record EngineAnalysisResult(String bestMove, String evaluation) {
    public static EngineAnalysisResult empty() {
        return new EngineAnalysisResult(null, null);
    }

    public boolean hasMove() {
        return bestMove != null && !bestMove.isBlank() && !"(none)".equals(bestMove);
    }
}
