package org.chessarena.rules;

import org.chessarena.model.PieceColor;

public enum Outcome {
    WHITE_WINS,
    BLACK_WINS,
    DRAW;

    public static Outcome winFor(PieceColor winner) {
        return winner == PieceColor.WHITE ? WHITE_WINS : BLACK_WINS;
    }

    public String displayName() {
        return switch (this) {
            case WHITE_WINS -> "White wins";
            case BLACK_WINS -> "Black wins";
            case DRAW -> "Draw";
        };
    }

    /** PGN-style score, e.g. {@code 1-0}. */
    public String score() {
        return switch (this) {
            case WHITE_WINS -> "1-0";
            case BLACK_WINS -> "0-1";
            case DRAW -> "1/2-1/2";
        };
    }
}
