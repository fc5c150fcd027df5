package org.chessarena.model;

/**
 * Board coordinate. Row 0 is rank 8 and column 0 is file a, so iterating rows
 * then columns visits the board top-to-bottom, left-to-right.
 */
public record Square(int row, int col) {

    public static Square of(int row, int col) {
        return new Square(row, col);
    }

    /**
     * Parses algebraic coordinates such as {@code e4}.
     *
     * @return the square, or {@code null} if the text is not a square
     */
    public static Square parse(String notation) {
        if (notation == null || notation.length() != 2) {
            return null;
        }
        int col = Character.toLowerCase(notation.charAt(0)) - 'a';
        int rank = notation.charAt(1) - '0';
        Square square = new Square(8 - rank, col);
        return square.isValid() ? square : null;
    }

    public boolean isValid() {
        return row >= 0 && row < 8 && col >= 0 && col < 8;
    }

    public Square offset(int rowDelta, int colDelta) {
        return new Square(row + rowDelta, col + colDelta);
    }

    public int index() {
        return row * 8 + col;
    }

    public int rank() {
        return 8 - row;
    }

    public char fileChar() {
        return (char) ('a' + col);
    }

    public boolean isDarkSquare() {
        return (row + col) % 2 == 1;
    }

    public String toChessNotation() {
        return "" + fileChar() + rank();
    }

    @Override
    public String toString() {
        return toChessNotation();
    }
}
