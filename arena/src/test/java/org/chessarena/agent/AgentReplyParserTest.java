package org.chessarena.agent;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class AgentReplyParserTest {

    private final AgentReplyParser parser = new AgentReplyParser();

    @Test
    void extractsAllLabelledFields() {
        AgentReply reply = parser.parse("MOVE: Nf3\nTHOUGHT: Develop and control e5.\nTRASH: Your king looks nervous.");

        assertTrue(reply.hasMove());
        assertEquals("Nf3", reply.move());
        assertEquals("Develop and control e5.", reply.thought());
        assertEquals("Your king looks nervous.", reply.trash());
    }

    @Test
    void labelsAreCaseInsensitiveAndMayBeBold() {
        AgentReply reply = parser.parse("Sure!\n**Move:** e4\n**thought**: central space");

        assertEquals("e4", reply.move());
        assertEquals("central space", reply.thought());
        assertNull(reply.trash());
    }

    @Test
    void replyWithoutMoveFieldHasNoMove() {
        AgentReply reply = parser.parse("I think e4 is the best move here.");

        assertFalse(reply.hasMove());
        assertEquals("I think e4 is the best move here.", reply.raw());
    }

    @Test
    void nullContentParsesToEmptyReply() {
        AgentReply reply = parser.parse(null);

        assertFalse(reply.hasMove());
        assertNull(reply.raw());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "`e4`            | e4",
            "**Nf3**         | Nf3",
            "\"O-O\"         | O-O",
            "1. e4           | e4",
            "12... Qxd5      | Qxd5",
            "e4, a classic   | e4",
            "Nf3.            | Nf3",
            "[exd5]          | exd5"
    })
    void moveIsReducedToItsToken(String raw, String expected) {
        assertEquals(expected, parser.cleanMove(raw));
    }

    @Test
    void markupOnlyMoveIsTreatedAsMissing() {
        assertNull(parser.cleanMove("**"));
        assertFalse(parser.parse("MOVE: ``").hasMove());
    }
}
