package org.chessarena.rules;

import org.chessarena.model.Board;
import org.chessarena.model.CastlingRights;
import org.chessarena.model.Piece;
import org.chessarena.model.PieceColor;
import org.chessarena.model.Position;
import org.chessarena.model.Square;

/**
 * Reads and writes the six-field position text: board rows separated by
 * {@code /} with run-length encoded empty squares, side to move, castling
 * flags, en-passant square or {@code -}, half-move clock and full-move number.
 */
public final class FenCodec {
    private static final String NONE = "-";

    private FenCodec() {
    }

    public static String serialize(Position position) {
        StringBuilder fen = new StringBuilder();
        Board board = position.board();

        for (int row = 0; row < 8; row++) {
            int empty = 0;
            for (int col = 0; col < 8; col++) {
                Piece piece = board.get(row, col);
                if (piece == null) {
                    empty++;
                    continue;
                }
                if (empty > 0) {
                    fen.append(empty);
                    empty = 0;
                }
                fen.append(piece.toFenChar());
            }
            if (empty > 0) {
                fen.append(empty);
            }
            if (row < 7) {
                fen.append('/');
            }
        }

        fen.append(' ').append(position.sideToMove().fenSymbol())
                .append(' ').append(position.castling().toFen())
                .append(' ').append(position.enPassant() == null ? NONE : position.enPassant().toChessNotation())
                .append(' ').append(position.halfMoveClock())
                .append(' ').append(position.fullMoveNumber());
        return fen.toString();
    }

    /**
     * Parses position text. The two clock fields may be omitted and then
     * default to {@code 0} and {@code 1}.
     */
    public static Position parse(String fen) throws FenFormatException {
        if (fen == null || fen.isBlank()) {
            throw new FenFormatException("Position text is empty");
        }

        String[] fields = fen.trim().split("\\s+");
        if (fields.length != 4 && fields.length != 6) {
            throw new FenFormatException("Expected 6 fields but found " + fields.length + " in \"" + fen + "\"");
        }

        Board board = parseBoard(fields[0]);
        PieceColor side = parseSide(fields[1]);
        CastlingRights castling = parseCastling(fields[2]);
        Square enPassant = parseEnPassant(fields[3], side);
        int halfMoveClock = fields.length == 6 ? parseCounter(fields[4], "half-move clock", 0) : 0;
        int fullMoveNumber = fields.length == 6 ? parseCounter(fields[5], "full-move number", 1) : 1;

        return new Position(board, side, castling, enPassant, halfMoveClock, fullMoveNumber);
    }

    private static Board parseBoard(String layout) throws FenFormatException {
        String[] rows = layout.split("/", -1);
        if (rows.length != 8) {
            throw new FenFormatException("Board must have 8 ranks but has " + rows.length);
        }

        Board.Builder builder = Board.builder();
        for (int row = 0; row < 8; row++) {
            int col = 0;
            for (char symbol : rows[row].toCharArray()) {
                if (symbol >= '1' && symbol <= '8') {
                    col += symbol - '0';
                } else {
                    Piece piece = Piece.fromFenChar(symbol);
                    if (piece == null) {
                        throw new FenFormatException("Unknown piece symbol '" + symbol + "' on rank " + (8 - row));
                    }
                    if (col > 7) {
                        throw new FenFormatException("Rank " + (8 - row) + " has more than 8 squares");
                    }
                    builder.put(Square.of(row, col), piece);
                    col++;
                }
            }
            if (col != 8) {
                throw new FenFormatException("Rank " + (8 - row) + " describes " + col + " squares instead of 8");
            }
        }
        return builder.build();
    }

    private static PieceColor parseSide(String field) throws FenFormatException {
        if (field.length() != 1 || (field.charAt(0) != 'w' && field.charAt(0) != 'b')) {
            throw new FenFormatException("Side to move must be 'w' or 'b' but was \"" + field + "\"");
        }
        return PieceColor.fromFenSymbol(field.charAt(0));
    }

    private static CastlingRights parseCastling(String field) throws FenFormatException {
        if (NONE.equals(field)) {
            return CastlingRights.NONE;
        }
        boolean whiteKingside = false;
        boolean whiteQueenside = false;
        boolean blackKingside = false;
        boolean blackQueenside = false;
        for (char flag : field.toCharArray()) {
            switch (flag) {
                case 'K' -> whiteKingside = true;
                case 'Q' -> whiteQueenside = true;
                case 'k' -> blackKingside = true;
                case 'q' -> blackQueenside = true;
                default -> throw new FenFormatException("Unknown castling flag '" + flag + "'");
            }
        }
        return new CastlingRights(whiteKingside, whiteQueenside, blackKingside, blackQueenside);
    }

    private static Square parseEnPassant(String field, PieceColor side) throws FenFormatException {
        if (NONE.equals(field)) {
            return null;
        }
        Square square = Square.parse(field);
        if (square == null) {
            throw new FenFormatException("Invalid en-passant square \"" + field + "\"");
        }
        int expectedRank = side == PieceColor.WHITE ? 6 : 3;
        if (square.rank() != expectedRank) {
            throw new FenFormatException("En-passant square " + field + " must be on rank " + expectedRank);
        }
        return square;
    }

    private static int parseCounter(String field, String name, int minimum) throws FenFormatException {
        try {
            int value = Integer.parseInt(field);
            if (value < minimum) {
                throw new FenFormatException("Invalid " + name + ": " + field);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new FenFormatException("Invalid " + name + ": " + field);
        }
    }
}
