package org.chessarena.model;

public enum PieceType {
    PAWN('P'),
    KNIGHT('N'),
    BISHOP('B'),
    ROOK('R'),
    QUEEN('Q'),
    KING('K');

    private final char letter;

    PieceType(char letter) {
        this.letter = letter;
    }

    /** Upper-case letter used in notation and for white pieces in FEN. */
    public char letter() {
        return letter;
    }

    public boolean isSlider() {
        return this == BISHOP || this == ROOK || this == QUEEN;
    }

    public boolean isMinor() {
        return this == KNIGHT || this == BISHOP;
    }

    public String displayName() {
        return name().toLowerCase();
    }

    public static PieceType fromLetter(char letter) {
        return switch (Character.toUpperCase(letter)) {
            case 'P' -> PAWN;
            case 'N' -> KNIGHT;
            case 'B' -> BISHOP;
            case 'R' -> ROOK;
            case 'Q' -> QUEEN;
            case 'K' -> KING;
            default -> null;
        };
    }
}
