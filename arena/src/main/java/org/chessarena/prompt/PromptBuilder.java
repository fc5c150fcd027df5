package org.chessarena.prompt;

import org.chessarena.match.MatchLog;
import org.chessarena.model.PieceColor;
import org.chessarena.model.Position;

public interface PromptBuilder {

    String buildPrompt(Position position, PieceColor side, MatchLog log);

    String buildCorrectionPrompt(Position position, PieceColor side, String rejectedMove, String reason);
}
