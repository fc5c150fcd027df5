package org.chessarena.model;

import java.util.Objects;

public final class Piece {
    private final PieceType type;
    private final PieceColor color;

    public Piece(PieceType type, PieceColor color) {
        this.type = Objects.requireNonNull(type, "type");
        this.color = Objects.requireNonNull(color, "color");
    }

    public static Piece of(PieceColor color, PieceType type) {
        return new Piece(type, color);
    }

    public PieceType getType() {
        return type;
    }

    public PieceColor getColor() {
        return color;
    }

    public boolean is(PieceColor color, PieceType type) {
        return this.color == color && this.type == type;
    }

    public char toFenChar() {
        char letter = type.letter();
        return color == PieceColor.WHITE ? letter : Character.toLowerCase(letter);
    }

    public static Piece fromFenChar(char symbol) {
        PieceType type = PieceType.fromLetter(symbol);
        if (type == null) {
            return null;
        }
        PieceColor color = Character.isUpperCase(symbol) ? PieceColor.WHITE : PieceColor.BLACK;
        return new Piece(type, color);
    }

    public String getSymbol() {
        return switch (type) {
            case KING -> color == PieceColor.WHITE ? "♔" : "♚";
            case QUEEN -> color == PieceColor.WHITE ? "♕" : "♛";
            case ROOK -> color == PieceColor.WHITE ? "♖" : "♜";
            case BISHOP -> color == PieceColor.WHITE ? "♗" : "♝";
            case KNIGHT -> color == PieceColor.WHITE ? "♘" : "♞";
            case PAWN -> color == PieceColor.WHITE ? "♙" : "♟";
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Piece other)) return false;
        return type == other.type && color == other.color;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, color);
    }

    @Override
    public String toString() {
        return color + " " + type;
    }
}
