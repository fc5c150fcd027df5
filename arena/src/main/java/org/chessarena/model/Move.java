package org.chessarena.model;

/**
 * A fully resolved move. Moves are value objects and never touch a board;
 * applying one always yields a new {@link Position}.
 *
 * @param piece      type of the moving piece
 * @param capture    whether the move removes an enemy piece, en passant included
 * @param castleSide set for castling moves, otherwise {@code null}
 * @param promotion  piece a pawn turns into, otherwise {@code null}
 */
public record Move(Square from,
                   Square to,
                   PieceType piece,
                   boolean capture,
                   CastleSide castleSide,
                   boolean enPassant,
                   PieceType promotion) {

    public static Move quiet(Square from, Square to, PieceType piece) {
        return new Move(from, to, piece, false, null, false, null);
    }

    public static Move capture(Square from, Square to, PieceType piece) {
        return new Move(from, to, piece, true, null, false, null);
    }

    public static Move castle(PieceColor color, CastleSide side) {
        int row = color.homeRow();
        return new Move(Square.of(row, 4), Square.of(row, side.kingTargetCol()), PieceType.KING,
                false, side, false, null);
    }

    public static Move enPassant(Square from, Square to) {
        return new Move(from, to, PieceType.PAWN, true, null, true, null);
    }

    public Move withPromotion(PieceType promotion) {
        return new Move(from, to, piece, capture, castleSide, enPassant, promotion);
    }

    public boolean isCastle() {
        return castleSide != null;
    }

    public boolean isPromotion() {
        return promotion != null;
    }

    /** Coordinate notation such as {@code e2e4} or {@code e7e8q}. */
    public String toUci() {
        String uci = from.toChessNotation() + to.toChessNotation();
        return promotion == null ? uci : uci + Character.toLowerCase(promotion.letter());
    }

    @Override
    public String toString() {
        return toUci();
    }
}
