package org.chessarena.model;

public enum PieceColor {
    WHITE('w'),
    BLACK('b');

    private final char fenSymbol;

    PieceColor(char fenSymbol) {
        this.fenSymbol = fenSymbol;
    }

    public PieceColor opposite() {
        return this == WHITE ? BLACK : WHITE;
    }

    public char fenSymbol() {
        return fenSymbol;
    }

    /** Row a pawn of this color starts on; row 0 is rank 8. */
    public int pawnStartRow() {
        return this == WHITE ? 6 : 1;
    }

    public int promotionRow() {
        return this == WHITE ? 0 : 7;
    }

    public int homeRow() {
        return this == WHITE ? 7 : 0;
    }

    public int pawnDirection() {
        return this == WHITE ? -1 : 1;
    }

    public String displayName() {
        return this == WHITE ? "White" : "Black";
    }

    public static PieceColor fromFenSymbol(char symbol) {
        return switch (symbol) {
            case 'w' -> WHITE;
            case 'b' -> BLACK;
            default -> throw new IllegalArgumentException("Unknown side symbol: " + symbol);
        };
    }
}
