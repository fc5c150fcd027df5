package org.chessarena.rules;

import org.chessarena.model.Board;
import org.chessarena.model.CastleSide;
import org.chessarena.model.CastlingRights;
import org.chessarena.model.Move;
import org.chessarena.model.Piece;
import org.chessarena.model.PieceColor;
import org.chessarena.model.PieceType;
import org.chessarena.model.Position;
import org.chessarena.model.Square;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Chess legality evaluator. Holds no position of its own: every operation
 * receives the position it works on and returns a verdict or a new position.
 */
public class RuleEngine {
    private static final Logger logger = LoggerFactory.getLogger(RuleEngine.class);

    private static final int[][] KNIGHT_OFFSETS = {
            {-2, -1}, {-2, 1}, {-1, -2}, {-1, 2}, {1, -2}, {1, 2}, {2, -1}, {2, 1}
    };
    private static final int[][] KING_OFFSETS = {
            {-1, -1}, {-1, 0}, {-1, 1}, {0, -1}, {0, 1}, {1, -1}, {1, 0}, {1, 1}
    };
    private static final int[][] DIAGONALS = {{-1, -1}, {-1, 1}, {1, -1}, {1, 1}};
    private static final int[][] ORTHOGONALS = {{-1, 0}, {1, 0}, {0, -1}, {0, 1}};
    private static final PieceType[] PROMOTIONS = {
            PieceType.QUEEN, PieceType.ROOK, PieceType.BISHOP, PieceType.KNIGHT
    };

    private final boolean defaultPromotionToQueen;

    public RuleEngine() {
        this(true);
    }

    /**
     * @param defaultPromotionToQueen whether a promoting pawn move without a
     *                                promotion piece is read as a queen promotion
     */
    public RuleEngine(boolean defaultPromotionToQueen) {
        this.defaultPromotionToQueen = defaultPromotionToQueen;
    }

    /**
     * Resolves move text against a position. When several pieces of the named
     * kind can reach the destination and the text carries no file or rank
     * hint, the first piece in board-scan order (rank 8 to rank 1, file a to
     * file h) is chosen. Hints that still leave more than one piece are
     * rejected as ambiguous.
     */
    public MoveValidation validateMove(Position position, String notation) {
        MoveNotation parsed = MoveNotation.parse(notation);
        if (parsed == null) {
            return reject(notation, "Invalid move notation: \"" + notation
                    + "\". Expected format like e4, Nf3, O-O, exd5");
        }

        if (parsed.isCastling()) {
            return logged(notation, validateCastling(position, parsed.castleSide()));
        }

        PieceColor side = position.sideToMove();
        String sideName = side.displayName();
        PieceType pieceType = parsed.piece();

        if (!parsed.pieceExplicit() && parsed.hasFullSource()) {
            Square source = Square.of(parsed.fromRow(), parsed.fromCol());
            Piece sourcePiece = position.pieceAt(source);
            if (sourcePiece == null) {
                return reject(notation, "There is no piece on " + source);
            }
            if (sourcePiece.getColor() != side) {
                return reject(notation, "The piece on " + source + " belongs to " + side.opposite().displayName());
            }
            pieceType = sourcePiece.getType();
        }

        Square target = parsed.target();
        if (pieceType == PieceType.KING) {
            CastleSide castleSide = castlingByKingStep(position, parsed, target);
            if (castleSide != null) {
                return logged(notation, validateCastling(position, castleSide));
            }
        }

        Piece occupant = position.pieceAt(target);
        if (occupant != null && occupant.getColor() == side) {
            return reject(notation, "Cannot capture your own piece on " + target);
        }

        boolean enPassantTarget = target.equals(position.enPassant());
        if (parsed.capture() && occupant == null && !(pieceType == PieceType.PAWN && enPassantTarget)) {
            return reject(notation, "Move indicates a capture but " + target + " is empty");
        }

        final PieceType movingType = pieceType;
        List<Move> reaching = pseudoLegalMoves(position).stream()
                .filter(move -> move.piece() == movingType)
                .filter(move -> move.to().equals(target))
                .filter(move -> parsed.matchesSource(move.from()))
                .filter(parsed::permitsPawnMove)
                .collect(Collectors.toList());

        if (reaching.isEmpty()) {
            return reject(notation, describeUnreachable(position, parsed, movingType));
        }

        List<Move> candidates = reaching.stream()
                .filter(move -> !leavesKingInCheck(position, move))
                .collect(Collectors.toList());

        if (candidates.isEmpty()) {
            return reject(notation, "Illegal move: " + parsed.text() + " would leave the "
                    + sideName.toLowerCase() + " king in check");
        }

        if (candidates.get(0).isPromotion()) {
            PieceType choice = parsed.promotion();
            if (choice == null) {
                if (!defaultPromotionToQueen) {
                    return reject(notation, "Promotion piece required: write " + target + "=Q, "
                            + target + "=R, " + target + "=B or " + target + "=N");
                }
                choice = PieceType.QUEEN;
            }
            final PieceType promotion = choice;
            candidates = candidates.stream()
                    .filter(move -> move.promotion() == promotion)
                    .collect(Collectors.toList());
        } else if (parsed.promotion() != null) {
            return reject(notation, "Promotion is only possible when a pawn reaches the last rank");
        }

        Set<Square> sources = new LinkedHashSet<>();
        candidates.forEach(move -> sources.add(move.from()));
        if (sources.size() > 1 && parsed.hasHints()) {
            return reject(notation, "Ambiguous move " + parsed.text() + ": pieces on "
                    + sources.stream().map(Square::toString).collect(Collectors.joining(" and "))
                    + " can all reach " + target + "; give both file and rank");
        }

        Move move = candidates.get(0);
        logger.debug("Validated {} as {}", notation, move);
        return MoveValidation.legal(move);
    }

    /**
     * Pure transition from a position and a move to the following position.
     * The move is trusted; call {@link #validateMove} first.
     */
    public Position applyMove(Position position, Move move) {
        Piece moving = position.pieceAt(move.from());
        if (moving == null) {
            throw new IllegalArgumentException("No piece on " + move.from() + " to move");
        }

        PieceColor side = position.sideToMove();
        Piece captured = move.enPassant()
                ? position.pieceAt(Square.of(move.from().row(), move.to().col()))
                : position.pieceAt(move.to());
        Board board = movePieces(position.board(), move, moving.getColor());

        CastlingRights castling = position.castling();
        if (moving.getType() == PieceType.KING) {
            castling = castling.without(moving.getColor());
        }
        castling = stripCornerRights(castling, move.from());
        castling = stripCornerRights(castling, move.to());

        Square enPassant = null;
        if (moving.getType() == PieceType.PAWN && Math.abs(move.to().row() - move.from().row()) == 2) {
            enPassant = Square.of((move.from().row() + move.to().row()) / 2, move.from().col());
        }

        boolean resetsClock = moving.getType() == PieceType.PAWN || captured != null;
        int halfMoveClock = resetsClock ? 0 : position.halfMoveClock() + 1;
        int fullMoveNumber = side == PieceColor.BLACK ? position.fullMoveNumber() + 1 : position.fullMoveNumber();

        return new Position(board, side.opposite(), castling, enPassant, halfMoveClock, fullMoveNumber);
    }

    public boolean isInCheck(PieceColor color, Position position) {
        return isKingAttacked(position.board(), color);
    }

    /**
     * Evaluates end-of-game conditions in precedence order: checkmate,
     * stalemate, insufficient material, threefold repetition, fifty-move rule.
     *
     * @param history positions that occurred before {@code position}
     */
    public TerminalState terminalState(Position position, List<Position> history) {
        PieceColor side = position.sideToMove();
        if (!hasLegalMove(position)) {
            if (isInCheck(side, position)) {
                return TerminalState.of(Outcome.winFor(side.opposite()), TerminationReason.CHECKMATE);
            }
            return TerminalState.of(Outcome.DRAW, TerminationReason.STALEMATE);
        }
        if (hasInsufficientMaterial(position.board())) {
            return TerminalState.of(Outcome.DRAW, TerminationReason.INSUFFICIENT_MATERIAL);
        }
        if (repetitionCount(position, history) >= 3) {
            return TerminalState.of(Outcome.DRAW, TerminationReason.THREEFOLD_REPETITION);
        }
        if (position.halfMoveClock() >= 100) {
            return TerminalState.of(Outcome.DRAW, TerminationReason.FIFTY_MOVE_RULE);
        }
        return TerminalState.ongoing();
    }

    /**
     * All moves for the side to move that do not leave its own king in check,
     * recomputed on every call.
     */
    public List<Move> legalMoves(Position position) {
        List<Move> legal = new ArrayList<>();
        for (Move move : pseudoLegalMoves(position)) {
            if (!leavesKingInCheck(position, move)) {
                legal.add(move);
            }
        }
        for (CastleSide side : CastleSide.values()) {
            if (validateCastling(position, side).legal()) {
                legal.add(Move.castle(position.sideToMove(), side));
            }
        }
        return legal;
    }

    /**
     * Standard algebraic notation for a legal move, with the minimal
     * disambiguation and a check or mate suffix.
     */
    public String toSan(Position position, Move move) {
        StringBuilder san = new StringBuilder();
        if (move.isCastle()) {
            san.append(move.castleSide().notation());
        } else if (move.piece() == PieceType.PAWN) {
            if (move.capture()) {
                san.append(move.from().fileChar()).append('x');
            }
            san.append(move.to());
            if (move.isPromotion()) {
                san.append('=').append(move.promotion().letter());
            }
        } else {
            san.append(move.piece().letter());
            san.append(disambiguation(position, move));
            if (move.capture()) {
                san.append('x');
            }
            san.append(move.to());
        }

        Position after = applyMove(position, move);
        if (isInCheck(after.sideToMove(), after)) {
            san.append(hasLegalMove(after) ? '+' : '#');
        }
        return san.toString();
    }

    public int repetitionCount(Position position, List<Position> history) {
        Position.RepetitionKey key = position.repetitionKey();
        long earlier = history.stream().filter(previous -> key.equals(previous.repetitionKey())).count();
        return (int) earlier + 1;
    }

    /**
     * King-versus-king, king and a single minor piece versus king, or bishops
     * only with every bishop on the same square color.
     */
    public boolean hasInsufficientMaterial(Board board) {
        List<Piece> pieces = new ArrayList<>();
        List<Square> squares = new ArrayList<>();
        for (PieceColor color : PieceColor.values()) {
            for (Square square : board.occupiedBy(color)) {
                Piece piece = board.get(square);
                if (piece.getType() != PieceType.KING) {
                    pieces.add(piece);
                    squares.add(square);
                }
            }
        }

        if (pieces.isEmpty()) {
            return true;
        }
        if (pieces.size() == 1) {
            return pieces.get(0).getType().isMinor();
        }

        Boolean darkSquares = null;
        for (int i = 0; i < pieces.size(); i++) {
            if (pieces.get(i).getType() != PieceType.BISHOP) {
                return false;
            }
            boolean dark = squares.get(i).isDarkSquare();
            if (darkSquares == null) {
                darkSquares = dark;
            } else if (darkSquares != dark) {
                return false;
            }
        }
        return true;
    }

    public boolean isSquareAttacked(Board board, Square square, PieceColor attacker) {
        int pawnRow = square.row() - attacker.pawnDirection();
        for (int dc = -1; dc <= 1; dc += 2) {
            Piece piece = board.get(pawnRow, square.col() + dc);
            if (piece != null && piece.is(attacker, PieceType.PAWN)) {
                return true;
            }
        }
        if (attackedByStep(board, square, attacker, KNIGHT_OFFSETS, PieceType.KNIGHT)
                || attackedByStep(board, square, attacker, KING_OFFSETS, PieceType.KING)) {
            return true;
        }
        return attackedByRay(board, square, attacker, DIAGONALS, PieceType.BISHOP)
                || attackedByRay(board, square, attacker, ORTHOGONALS, PieceType.ROOK);
    }

    private MoveValidation validateCastling(Position position, CastleSide side) {
        PieceColor color = position.sideToMove();
        Board board = position.board();

        if (!position.castling().has(color, side)) {
            return MoveValidation.illegal("Castling " + side.displayName() + " is not available");
        }

        int row = color.homeRow();
        Square kingSquare = Square.of(row, 4);
        Square rookSquare = Square.of(row, side.rookCol());
        Piece king = board.get(kingSquare);
        Piece rook = board.get(rookSquare);
        if (king == null || !king.is(color, PieceType.KING)) {
            return MoveValidation.illegal("No king on " + kingSquare + " to castle");
        }
        if (rook == null || !rook.is(color, PieceType.ROOK)) {
            return MoveValidation.illegal("No rook on " + rookSquare + " to castle with");
        }

        int low = Math.min(4, side.rookCol());
        int high = Math.max(4, side.rookCol());
        for (int col = low + 1; col < high; col++) {
            if (!board.isEmpty(Square.of(row, col))) {
                return MoveValidation.illegal("Castling path is blocked");
            }
        }

        PieceColor opponent = color.opposite();
        if (isSquareAttacked(board, kingSquare, opponent)) {
            return MoveValidation.illegal("Cannot castle while in check");
        }

        int step = side == CastleSide.KINGSIDE ? 1 : -1;
        if (isSquareAttacked(board, Square.of(row, 4 + step), opponent)) {
            return MoveValidation.illegal("Cannot castle through check");
        }

        Move move = Move.castle(color, side);
        if (isKingAttacked(movePieces(board, move, color), color)) {
            return MoveValidation.illegal("Cannot castle into check");
        }
        return MoveValidation.legal(move);
    }

    /** A king named as moving two files along its home rank from e-file means castling. */
    private CastleSide castlingByKingStep(Position position, MoveNotation parsed, Square target) {
        PieceColor color = position.sideToMove();
        Square home = Square.of(color.homeRow(), 4);
        Piece king = position.pieceAt(home);
        if (king == null || !king.is(color, PieceType.KING) || !parsed.matchesSource(home)) {
            return null;
        }
        if (target.row() != home.row()) {
            return null;
        }
        if (target.col() == CastleSide.KINGSIDE.kingTargetCol()) {
            return CastleSide.KINGSIDE;
        }
        if (target.col() == CastleSide.QUEENSIDE.kingTargetCol()) {
            return CastleSide.QUEENSIDE;
        }
        return null;
    }

    private String describeUnreachable(Position position, MoveNotation parsed, PieceType pieceType) {
        PieceColor side = position.sideToMove();
        String owner = side.displayName();
        List<Square> owned = position.board().occupiedBy(side).stream()
                .filter(square -> position.pieceAt(square).getType() == pieceType)
                .collect(Collectors.toList());

        if (owned.isEmpty()) {
            return owner + " has no " + pieceType.displayName() + " on the board";
        }
        if (parsed.hasHints() && owned.stream().noneMatch(parsed::matchesSource)) {
            return owner + " has no " + pieceType.displayName() + " on " + parsed.describeSource();
        }
        String from = parsed.hasHints() ? " on " + parsed.describeSource() : "";
        return "No " + owner.toLowerCase() + " " + pieceType.displayName() + from + " can reach " + parsed.target();
    }

    private String disambiguation(Position position, Move move) {
        List<Square> rivals = new ArrayList<>();
        for (Move other : legalMoves(position)) {
            if (other.piece() == move.piece() && other.to().equals(move.to()) && !other.from().equals(move.from())) {
                rivals.add(other.from());
            }
        }
        if (rivals.isEmpty()) {
            return "";
        }
        boolean sharesFile = rivals.stream().anyMatch(square -> square.col() == move.from().col());
        boolean sharesRank = rivals.stream().anyMatch(square -> square.row() == move.from().row());
        if (!sharesFile) {
            return String.valueOf(move.from().fileChar());
        }
        if (!sharesRank) {
            return String.valueOf(move.from().rank());
        }
        return move.from().toChessNotation();
    }

    private boolean hasLegalMove(Position position) {
        for (Move move : pseudoLegalMoves(position)) {
            if (!leavesKingInCheck(position, move)) {
                return true;
            }
        }
        return false;
    }

    /** Moves that obey piece movement, ignoring king safety. Castling is handled separately. */
    private List<Move> pseudoLegalMoves(Position position) {
        List<Move> moves = new ArrayList<>();
        Board board = position.board();
        PieceColor side = position.sideToMove();

        for (Square from : board.occupiedBy(side)) {
            Piece piece = board.get(from);
            switch (piece.getType()) {
                case PAWN -> addPawnMoves(position, from, side, moves);
                case KNIGHT -> addStepMoves(board, from, piece, KNIGHT_OFFSETS, moves);
                case KING -> addStepMoves(board, from, piece, KING_OFFSETS, moves);
                case BISHOP -> addRayMoves(board, from, piece, DIAGONALS, moves);
                case ROOK -> addRayMoves(board, from, piece, ORTHOGONALS, moves);
                case QUEEN -> {
                    addRayMoves(board, from, piece, DIAGONALS, moves);
                    addRayMoves(board, from, piece, ORTHOGONALS, moves);
                }
            }
        }
        return moves;
    }

    private void addPawnMoves(Position position, Square from, PieceColor side, List<Move> moves) {
        Board board = position.board();
        int direction = side.pawnDirection();

        Square oneStep = from.offset(direction, 0);
        if (oneStep.isValid() && board.isEmpty(oneStep)) {
            addPawnMove(Move.quiet(from, oneStep, PieceType.PAWN), side, moves);
            Square twoStep = from.offset(2 * direction, 0);
            if (from.row() == side.pawnStartRow() && board.isEmpty(twoStep)) {
                moves.add(Move.quiet(from, twoStep, PieceType.PAWN));
            }
        }

        for (int dc = -1; dc <= 1; dc += 2) {
            Square target = from.offset(direction, dc);
            if (!target.isValid()) {
                continue;
            }
            Piece occupant = board.get(target);
            if (occupant != null && occupant.getColor() != side) {
                addPawnMove(Move.capture(from, target, PieceType.PAWN), side, moves);
            } else if (occupant == null && target.equals(position.enPassant())) {
                moves.add(Move.enPassant(from, target));
            }
        }
    }

    private void addPawnMove(Move move, PieceColor side, List<Move> moves) {
        if (move.to().row() != side.promotionRow()) {
            moves.add(move);
            return;
        }
        for (PieceType promotion : PROMOTIONS) {
            moves.add(move.withPromotion(promotion));
        }
    }

    private void addStepMoves(Board board, Square from, Piece piece, int[][] offsets, List<Move> moves) {
        for (int[] offset : offsets) {
            Square target = from.offset(offset[0], offset[1]);
            if (!target.isValid()) {
                continue;
            }
            Piece occupant = board.get(target);
            if (occupant == null) {
                moves.add(Move.quiet(from, target, piece.getType()));
            } else if (occupant.getColor() != piece.getColor()) {
                moves.add(Move.capture(from, target, piece.getType()));
            }
        }
    }

    private void addRayMoves(Board board, Square from, Piece piece, int[][] directions, List<Move> moves) {
        for (int[] direction : directions) {
            Square target = from.offset(direction[0], direction[1]);
            while (target.isValid()) {
                Piece occupant = board.get(target);
                if (occupant == null) {
                    moves.add(Move.quiet(from, target, piece.getType()));
                } else {
                    if (occupant.getColor() != piece.getColor()) {
                        moves.add(Move.capture(from, target, piece.getType()));
                    }
                    break;
                }
                target = target.offset(direction[0], direction[1]);
            }
        }
    }

    private boolean leavesKingInCheck(Position position, Move move) {
        PieceColor side = position.sideToMove();
        return isKingAttacked(movePieces(position.board(), move, side), side);
    }

    private boolean isKingAttacked(Board board, PieceColor color) {
        Square king = board.findKing(color);
        return king != null && isSquareAttacked(board, king, color.opposite());
    }

    private boolean attackedByStep(Board board, Square square, PieceColor attacker, int[][] offsets, PieceType type) {
        for (int[] offset : offsets) {
            Piece piece = board.get(square.offset(offset[0], offset[1]));
            if (piece != null && piece.is(attacker, type)) {
                return true;
            }
        }
        return false;
    }

    /** Rays also match queens, which combine both ray kinds. */
    private boolean attackedByRay(Board board, Square square, PieceColor attacker, int[][] directions, PieceType type) {
        for (int[] direction : directions) {
            Square current = square.offset(direction[0], direction[1]);
            while (current.isValid()) {
                Piece piece = board.get(current);
                if (piece != null) {
                    if (piece.getColor() == attacker
                            && (piece.getType() == type || piece.getType() == PieceType.QUEEN)) {
                        return true;
                    }
                    break;
                }
                current = current.offset(direction[0], direction[1]);
            }
        }
        return false;
    }

    private Board movePieces(Board board, Move move, PieceColor color) {
        Board.Builder builder = board.toBuilder().move(move.from(), move.to());
        if (move.enPassant()) {
            builder.remove(Square.of(move.from().row(), move.to().col()));
        }
        if (move.isPromotion()) {
            builder.put(move.to(), Piece.of(color, move.promotion()));
        }
        if (move.isCastle()) {
            int row = move.from().row();
            builder.move(Square.of(row, move.castleSide().rookCol()), Square.of(row, move.castleSide().rookTargetCol()));
        }
        return builder.build();
    }

    private static CastlingRights stripCornerRights(CastlingRights castling, Square square) {
        if (square.row() == 7 && square.col() == 0) {
            return castling.without(PieceColor.WHITE, CastleSide.QUEENSIDE);
        }
        if (square.row() == 7 && square.col() == 7) {
            return castling.without(PieceColor.WHITE, CastleSide.KINGSIDE);
        }
        if (square.row() == 0 && square.col() == 0) {
            return castling.without(PieceColor.BLACK, CastleSide.QUEENSIDE);
        }
        if (square.row() == 0 && square.col() == 7) {
            return castling.without(PieceColor.BLACK, CastleSide.KINGSIDE);
        }
        return castling;
    }

    private MoveValidation logged(String notation, MoveValidation validation) {
        if (!validation.legal()) {
            logger.debug("Rejected {}: {}", notation, validation.reason());
        }
        return validation;
    }

    private MoveValidation reject(String notation, String reason) {
        logger.debug("Rejected {}: {}", notation, reason);
        return MoveValidation.illegal(reason);
    }
}
