package org.chessarena.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable 8x8 grid of pieces. Changes go through {@link Builder}, which
 * always produces a new board.
 */
public final class Board {
    private static final PieceType[] BACK_RANK = {
            PieceType.ROOK, PieceType.KNIGHT, PieceType.BISHOP, PieceType.QUEEN,
            PieceType.KING, PieceType.BISHOP, PieceType.KNIGHT, PieceType.ROOK
    };

    private final Piece[] squares;

    private Board(Piece[] squares) {
        this.squares = squares;
    }

    public static Board empty() {
        return new Board(new Piece[64]);
    }

    public static Board standard() {
        Builder builder = builder();
        for (int col = 0; col < 8; col++) {
            builder.put(Square.of(0, col), Piece.of(PieceColor.BLACK, BACK_RANK[col]));
            builder.put(Square.of(1, col), Piece.of(PieceColor.BLACK, PieceType.PAWN));
            builder.put(Square.of(6, col), Piece.of(PieceColor.WHITE, PieceType.PAWN));
            builder.put(Square.of(7, col), Piece.of(PieceColor.WHITE, BACK_RANK[col]));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder(new Piece[64]);
    }

    public Builder toBuilder() {
        return new Builder(squares.clone());
    }

    public Piece get(Square square) {
        return square.isValid() ? squares[square.index()] : null;
    }

    public Piece get(int row, int col) {
        return get(Square.of(row, col));
    }

    public boolean isEmpty(Square square) {
        return get(square) == null;
    }

    public Square findKing(PieceColor color) {
        for (int i = 0; i < 64; i++) {
            Piece piece = squares[i];
            if (piece != null && piece.is(color, PieceType.KING)) {
                return Square.of(i / 8, i % 8);
            }
        }
        return null;
    }

    /** Squares holding pieces of the given color, in board-scan order. */
    public List<Square> occupiedBy(PieceColor color) {
        List<Square> result = new ArrayList<>();
        for (int i = 0; i < 64; i++) {
            Piece piece = squares[i];
            if (piece != null && piece.getColor() == color) {
                result.add(Square.of(i / 8, i % 8));
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Board other)) return false;
        return Arrays.equals(squares, other.squares);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(squares);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (int row = 0; row < 8; row++) {
            for (int col = 0; col < 8; col++) {
                Piece piece = get(row, col);
                builder.append(piece == null ? '.' : piece.toFenChar());
            }
            if (row < 7) {
                builder.append('/');
            }
        }
        return builder.toString();
    }

    public static final class Builder {
        private final Piece[] squares;

        private Builder(Piece[] squares) {
            this.squares = squares;
        }

        public Builder put(Square square, Piece piece) {
            requireValid(square);
            squares[square.index()] = piece;
            return this;
        }

        public Builder remove(Square square) {
            return put(square, null);
        }

        public Builder move(Square from, Square to) {
            requireValid(from);
            Piece piece = squares[from.index()];
            squares[from.index()] = null;
            return put(to, piece);
        }

        public Board build() {
            return new Board(squares.clone());
        }

        private static void requireValid(Square square) {
            if (!square.isValid()) {
                throw new IllegalArgumentException("Square off the board: " + square.row() + "," + square.col());
            }
        }
    }
}
