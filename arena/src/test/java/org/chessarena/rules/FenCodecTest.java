package org.chessarena.rules;

import org.chessarena.model.CastlingRights;
import org.chessarena.model.Piece;
import org.chessarena.model.PieceColor;
import org.chessarena.model.PieceType;
import org.chessarena.model.Position;
import org.chessarena.model.Square;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class FenCodecTest {

    @Test
    void parsesStandardStart() throws FenFormatException {
        Position position = FenCodec.parse(Position.STANDARD_FEN);

        assertEquals(Position.standard(), position);
        assertEquals(PieceColor.WHITE, position.sideToMove());
        assertEquals(CastlingRights.ALL, position.castling());
        assertNull(position.enPassant());
        assertEquals(Piece.of(PieceColor.WHITE, PieceType.KING), position.pieceAt(Square.parse("e1")));
        assertEquals(Piece.of(PieceColor.BLACK, PieceType.QUEEN), position.pieceAt(Square.parse("d8")));
    }

    @Test
    void serializesStandardStart() {
        assertEquals(Position.STANDARD_FEN, FenCodec.serialize(Position.standard()));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq e3 0 1",
            "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1",
            "8/2p5/3p4/KP5r/1R3p1k/8/4P1P1/8 w - - 0 1",
            "r3k2r/8/8/8/8/8/8/R3K2R w K - 3 17",
            "r3k2r/8/8/8/8/8/8/R3K2R b Qk - 12 40",
            "r3k2r/8/8/8/8/8/8/R3K2R w q - 0 2",
            "4k3/8/8/8/8/8/8/4K3 b - - 99 120"
    })
    void roundTripsPositions(String fen) throws FenFormatException {
        assertEquals(fen, FenCodec.serialize(FenCodec.parse(fen)));
    }

    @Test
    void roundTripsEveryCastlingCombination() throws FenFormatException {
        for (int mask = 0; mask < 16; mask++) {
            CastlingRights rights = new CastlingRights((mask & 1) != 0, (mask & 2) != 0, (mask & 4) != 0, (mask & 8) != 0);
            String fen = "r3k2r/8/8/8/8/8/8/R3K2R w " + rights.toFen() + " - 0 1";
            Position parsed = FenCodec.parse(fen);
            assertEquals(rights, parsed.castling());
            assertEquals(parsed, FenCodec.parse(FenCodec.serialize(parsed)));
        }
    }

    @Test
    void clockFieldsDefaultWhenOmitted() throws FenFormatException {
        Position position = FenCodec.parse("4k3/8/8/8/8/8/8/4K3 w - -");

        assertEquals(0, position.halfMoveClock());
        assertEquals(1, position.fullMoveNumber());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP w KQkq - 0 1",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNX w KQkq - 0 1",
            "rnbqkbnr/pppppppp/9/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR x KQkq - 0 1",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkx - 0 1",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq e4 0 1",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - -1 1",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 0",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0"
    })
    void rejectsMalformedText(String fen) {
        assertThrows(FenFormatException.class, () -> FenCodec.parse(fen));
    }

    @Test
    void errorNamesTheOffendingField() {
        FenFormatException error = assertThrows(FenFormatException.class,
                () -> FenCodec.parse("rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - zero 1"));

        assertTrue(error.getMessage().contains("half-move clock"));
    }
}
