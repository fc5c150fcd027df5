package org.chessarena.rules;

import org.chessarena.model.CastleSide;
import org.chessarena.model.Move;
import org.chessarena.model.PieceType;
import org.chessarena.model.Square;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed form of a SAN-like move token. A token that names a full source
 * square without a piece letter ({@code e2e4}, {@code g1f3}) is coordinate
 * notation and leaves the piece to be read from the board. Piece letters are
 * accepted in lower case except {@code b}, which always reads as the b-file.
 *
 * @param fromCol  disambiguating file, or {@code -1}
 * @param fromRow  disambiguating rank as a board row, or {@code -1}
 */
public record MoveNotation(String text,
                           PieceType piece,
                           boolean pieceExplicit,
                           int fromCol,
                           int fromRow,
                           boolean capture,
                           Square target,
                           PieceType promotion,
                           CastleSide castleSide) {

    private static final Pattern CASTLING = Pattern.compile("^([O0o])-([O0o])(-([O0o]))?$");
    private static final Pattern MOVE = Pattern.compile(
            "^([KQRBNkqrn])?([a-h])?([1-8])?([x:])?([a-h][1-8])(?:=?([QRBNqrbn]))?$");
    private static final Pattern ANNOTATIONS = Pattern.compile("(\\s*e\\.p\\.)?[+#!?]*$");

    /**
     * @return the parsed token, or {@code null} when the text is not move notation
     */
    public static MoveNotation parse(String raw) {
        if (raw == null) {
            return null;
        }
        String text = ANNOTATIONS.matcher(raw.trim()).replaceFirst("");
        if (text.isEmpty()) {
            return null;
        }

        Matcher castling = CASTLING.matcher(text);
        if (castling.matches()) {
            CastleSide side = castling.group(3) == null ? CastleSide.KINGSIDE : CastleSide.QUEENSIDE;
            return new MoveNotation(raw.trim(), PieceType.KING, true, -1, -1, false, null, null, side);
        }

        Matcher move = MOVE.matcher(text);
        if (!move.matches()) {
            return null;
        }

        PieceType piece = move.group(1) == null ? PieceType.PAWN : PieceType.fromLetter(move.group(1).charAt(0));
        int fromCol = move.group(2) == null ? -1 : move.group(2).charAt(0) - 'a';
        int fromRow = move.group(3) == null ? -1 : 8 - (move.group(3).charAt(0) - '0');
        PieceType promotion = move.group(6) == null ? null : PieceType.fromLetter(move.group(6).charAt(0));

        return new MoveNotation(raw.trim(), piece, move.group(1) != null, fromCol, fromRow,
                move.group(4) != null, Square.parse(move.group(5)), promotion, null);
    }

    public boolean isCastling() {
        return castleSide != null;
    }

    public boolean hasFullSource() {
        return fromCol >= 0 && fromRow >= 0;
    }

    public boolean hasHints() {
        return fromCol >= 0 || fromRow >= 0;
    }

    public boolean matchesSource(Square square) {
        return (fromCol < 0 || square.col() == fromCol) && (fromRow < 0 || square.row() == fromRow);
    }

    /**
     * A pawn changes file only when the token marks a capture or names the
     * source file, so a bare {@code e5} is never read as {@code dxe5}.
     */
    public boolean permitsPawnMove(Move move) {
        return move.piece() != PieceType.PAWN || capture || fromCol >= 0
                || move.from().col() == move.to().col();
    }

    public String describeSource() {
        if (hasFullSource()) {
            return Square.of(fromRow, fromCol).toChessNotation();
        }
        if (fromCol >= 0) {
            return "the " + (char) ('a' + fromCol) + "-file";
        }
        if (fromRow >= 0) {
            return "rank " + (8 - fromRow);
        }
        return "the board";
    }
}
