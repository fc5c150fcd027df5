package org.chessarena.model;

public record CastlingRights(boolean whiteKingside, boolean whiteQueenside,
                             boolean blackKingside, boolean blackQueenside) {

    public static final CastlingRights ALL = new CastlingRights(true, true, true, true);
    public static final CastlingRights NONE = new CastlingRights(false, false, false, false);

    public boolean has(PieceColor color, CastleSide side) {
        if (color == PieceColor.WHITE) {
            return side == CastleSide.KINGSIDE ? whiteKingside : whiteQueenside;
        }
        return side == CastleSide.KINGSIDE ? blackKingside : blackQueenside;
    }

    public CastlingRights without(PieceColor color, CastleSide side) {
        if (!has(color, side)) {
            return this;
        }
        boolean white = color == PieceColor.WHITE;
        boolean kingside = side == CastleSide.KINGSIDE;
        return new CastlingRights(
                whiteKingside && !(white && kingside),
                whiteQueenside && !(white && !kingside),
                blackKingside && !(!white && kingside),
                blackQueenside && !(!white && !kingside));
    }

    public CastlingRights without(PieceColor color) {
        return without(color, CastleSide.KINGSIDE).without(color, CastleSide.QUEENSIDE);
    }

    public String toFen() {
        StringBuilder builder = new StringBuilder();
        if (whiteKingside) builder.append('K');
        if (whiteQueenside) builder.append('Q');
        if (blackKingside) builder.append('k');
        if (blackQueenside) builder.append('q');
        return builder.length() == 0 ? "-" : builder.toString();
    }

    @Override
    public String toString() {
        return toFen();
    }
}
