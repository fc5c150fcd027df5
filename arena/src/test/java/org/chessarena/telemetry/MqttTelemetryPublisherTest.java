package org.chessarena.telemetry;

import org.chessarena.match.AgentActivity;
import org.chessarena.match.AgentUsage;
import org.chessarena.match.LogEntry;
import org.chessarena.match.LogType;
import org.chessarena.match.MatchStatus;
import org.chessarena.match.MoveRecord;
import org.chessarena.model.Move;
import org.chessarena.model.PieceColor;
import org.chessarena.model.PieceType;
import org.chessarena.model.Position;
import org.chessarena.model.Square;
import org.chessarena.rules.MatchResult;
import org.chessarena.rules.Outcome;
import org.chessarena.rules.TerminationReason;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MqttTelemetryPublisherTest {

    private static final class RecordingSink implements TelemetrySink {
        private final List<String> topics = new ArrayList<>();
        private final List<Object> payloads = new ArrayList<>();
        private volatile boolean connected = true;
        private volatile boolean failing = false;

        @Override
        public boolean isConnected() {
            return connected;
        }

        @Override
        public synchronized void publish(String topic, Object payload) throws MqttException {
            if (failing) {
                throw new MqttException(MqttException.REASON_CODE_CLIENT_NOT_CONNECTED);
            }
            topics.add(topic);
            payloads.add(payload);
        }
    }

    private final RecordingSink sink = new RecordingSink();
    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final MqttTelemetryPublisher publisher = new MqttTelemetryPublisher(sink, "arena-test", executor);

    private void drain() throws InterruptedException {
        publisher.close();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
    }

    @Test
    void eventsArePublishedUnderThePrefix() throws InterruptedException {
        Move e4 = Move.quiet(Square.parse("e2"), Square.parse("e4"), PieceType.PAWN);

        publisher.onStatusChanged(MatchStatus.IDLE, MatchStatus.RUNNING);
        publisher.onPositionChanged(Position.standard());
        publisher.onMoveApplied(new MoveRecord(1, PieceColor.WHITE, "e4", e4, null, null, MoveRecord.Source.AGENT));
        publisher.onLogEntry(new LogEntry(LogType.MOVE, PieceColor.WHITE, "e4", Instant.parse("2024-06-11T10:00:00Z")));
        drain();

        assertEquals(List.of("arena-test/status", "arena-test/position", "arena-test/move", "arena-test/log"),
                sink.topics);
        assertEquals(new MqttTelemetryPublisher.StatusMessage("RUNNING", "IDLE"), sink.payloads.get(0));
        assertEquals(new MqttTelemetryPublisher.PositionMessage(Position.STANDARD_FEN, "white", 1, 0),
                sink.payloads.get(1));
        assertEquals(new MqttTelemetryPublisher.MoveMessage(1, "white", "e4", "e2e4", "AGENT"), sink.payloads.get(2));
        assertEquals(new MqttTelemetryPublisher.LogMessage("MOVE", "white", "e4", "2024-06-11T10:00:00Z"),
                sink.payloads.get(3));
    }

    @Test
    void agentActivityIsPublishedPerSide() throws InterruptedException {
        publisher.onAgentActivity(new AgentActivity(PieceColor.BLACK, "Groq Llama",
                new AgentUsage(5, 1, 4000, 4), 1, 2, 3));
        drain();

        assertEquals(List.of("arena-test/agents/black"), sink.topics);
        assertEquals(new MqttTelemetryPublisher.AgentMessage("black", "Groq Llama", 5, 1, 4000, 1000, 1, 2, 3),
                sink.payloads.get(0));
    }

    @Test
    void gameOverPublishesTheResult() throws InterruptedException {
        publisher.onGameOver(new MatchResult(Outcome.DRAW, TerminationReason.STALEMATE));
        drain();

        assertEquals(List.of("arena-test/result"), sink.topics);
        assertEquals(new MqttTelemetryPublisher.ResultMessage("DRAW", "STALEMATE", "1/2-1/2"), sink.payloads.get(0));
    }

    @Test
    void matchWideLogEntriesHaveNoSide() throws InterruptedException {
        publisher.onLogEntry(new LogEntry(LogType.SYSTEM, null, "Match reset", Instant.EPOCH));
        drain();

        assertNull(((MqttTelemetryPublisher.LogMessage) sink.payloads.get(0)).side());
    }

    @Test
    void messagesAreDroppedWhileDisconnected() throws InterruptedException {
        sink.connected = false;

        publisher.onStatusChanged(MatchStatus.RUNNING, MatchStatus.PAUSED);
        drain();

        assertTrue(sink.topics.isEmpty());
    }

    @Test
    void publishFailuresDoNotStopLaterMessages() throws InterruptedException {
        sink.failing = true;
        publisher.onStatusChanged(MatchStatus.IDLE, MatchStatus.RUNNING);
        executor.submit(() -> {
            sink.failing = false;
        });
        publisher.onStatusChanged(MatchStatus.RUNNING, MatchStatus.PAUSED);
        drain();

        assertEquals(List.of("arena-test/status"), sink.topics);
    }

    @Test
    void eventsAfterCloseAreIgnored() throws InterruptedException {
        drain();

        publisher.onStatusChanged(MatchStatus.IDLE, MatchStatus.RUNNING);

        assertTrue(sink.topics.isEmpty());
    }

    @Test
    void blankPrefixFallsBackToDefault() {
        MqttTelemetryPublisher fallback = new MqttTelemetryPublisher(sink, " ", executor);

        assertEquals("chess-arena/status", fallback.topic("status"));
        executor.shutdown();
    }
}
