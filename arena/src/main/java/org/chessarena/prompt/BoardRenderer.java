package org.chessarena.prompt;

import org.chessarena.model.Board;
import org.chessarena.model.Piece;

/**
 * Text diagram of a board, rank 8 at the top.
 */
public final class BoardRenderer {

    private BoardRenderer() {
    }

    public static String render(Board board) {
        return render(board, false);
    }

    /**
     * @param unicode use chess glyphs instead of FEN letters
     */
    public static String render(Board board, boolean unicode) {
        StringBuilder builder = new StringBuilder();
        for (int row = 0; row < 8; row++) {
            builder.append(8 - row);
            for (int col = 0; col < 8; col++) {
                Piece piece = board.get(row, col);
                builder.append(' ');
                if (piece == null) {
                    builder.append('.');
                } else {
                    builder.append(unicode ? piece.getSymbol() : String.valueOf(piece.toFenChar()));
                }
            }
            builder.append('\n');
        }
        builder.append("  a b c d e f g h");
        return builder.toString();
    }
}
