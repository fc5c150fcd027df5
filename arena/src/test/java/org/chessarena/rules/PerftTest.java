package org.chessarena.rules;

import org.chessarena.model.Move;
import org.chessarena.model.Position;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Move-generation counts against well-known reference positions.
 */
class PerftTest {

    private final RuleEngine engine = new RuleEngine();

    private long perft(Position position, int depth) {
        if (depth == 0) {
            return 1;
        }
        long nodes = 0;
        for (Move move : engine.legalMoves(position)) {
            nodes += depth == 1 ? 1 : perft(engine.applyMove(position, move), depth - 1);
        }
        return nodes;
    }

    @ParameterizedTest(name = "{0} depth {1}")
    @CsvSource(delimiter = '|', value = {
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1 | 1 | 20",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1 | 2 | 400",
            "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1 | 3 | 8902",
            "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1 | 1 | 48",
            "r3k2r/p1ppqpb1/bn2pnp1/3PN3/1p2P3/2N2Q1p/PPPBBPPP/R3K2R w KQkq - 0 1 | 2 | 2039",
            "8/2p5/3p4/KP5r/1R3p1k/8/4P1P1/8 w - - 0 1 | 3 | 2812",
            "r3k2r/Pppp1ppp/1b3nbN/nP6/BBP1P3/q4N2/Pp1P2PP/R2Q1RK1 w kq - 0 1 | 2 | 264",
            "rnbq1k1r/pp1Pbppp/2p5/8/2B5/8/PPP1NnPP/RNBQK2R w KQ - 1 8 | 2 | 1486"
    })
    void legalMoveCountsMatchReference(String fen, int depth, long expected) throws FenFormatException {
        assertEquals(expected, perft(FenCodec.parse(fen), depth));
    }
}
