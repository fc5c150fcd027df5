package org.chessarena.telemetry;

import org.chessarena.match.AgentActivity;
import org.chessarena.match.LogEntry;
import org.chessarena.match.MatchListener;
import org.chessarena.match.MatchStatus;
import org.chessarena.match.MoveRecord;
import org.chessarena.model.PieceColor;
import org.chessarena.model.Position;
import org.chessarena.rules.MatchResult;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Mirrors match events to MQTT topics under a common prefix:
 * {@code <prefix>/status}, {@code <prefix>/position}, {@code <prefix>/move},
 * {@code <prefix>/log}, {@code <prefix>/result} and one
 * {@code <prefix>/agents/<side>} topic per side. Publishing happens off the
 * match thread.
 */
public class MqttTelemetryPublisher implements MatchListener, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MqttTelemetryPublisher.class);

    record StatusMessage(String status, String previous) {
    }

    record PositionMessage(String fen, String sideToMove, int fullMoveNumber, int halfMoveClock) {
    }

    record MoveMessage(int moveNumber, String side, String notation, String uci, String source) {
    }

    record LogMessage(String type, String side, String content, String timestamp) {
    }

    record AgentMessage(String side, String agent, int requests, int errors, long totalLatencyMs,
                        long averageLatencyMs, int hallucinations, int hallucinationCeiling,
                        int hallucinationTotal) {
    }

    record ResultMessage(String outcome, String reason, String score) {
    }

    private final TelemetrySink sink;
    private final String prefix;
    private final ExecutorService executor;

    public MqttTelemetryPublisher(TelemetrySink sink, String topicPrefix) {
        this(sink, topicPrefix, Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "telemetry-publisher-thread");
            thread.setDaemon(true);
            return thread;
        }));
    }

    MqttTelemetryPublisher(TelemetrySink sink, String topicPrefix, ExecutorService executor) {
        this.sink = sink;
        this.prefix = topicPrefix == null || topicPrefix.isBlank() ? "chess-arena" : topicPrefix;
        this.executor = executor;
    }

    @Override
    public void onStatusChanged(MatchStatus previous, MatchStatus current) {
        submit("status", new StatusMessage(current.name(), previous == null ? null : previous.name()));
    }

    @Override
    public void onPositionChanged(Position position) {
        submit("position", new PositionMessage(position.toFen(), sideName(position.sideToMove()),
                position.fullMoveNumber(), position.halfMoveClock()));
    }

    @Override
    public void onMoveApplied(MoveRecord record) {
        submit("move", new MoveMessage(record.moveNumber(), sideName(record.side()), record.notation(),
                record.move().toUci(), record.source().name()));
    }

    @Override
    public void onLogEntry(LogEntry entry) {
        submit("log", new LogMessage(entry.type().name(), sideName(entry.side()), entry.content(),
                entry.timestamp().toString()));
    }

    @Override
    public void onAgentActivity(AgentActivity activity) {
        String side = sideName(activity.side());
        submit("agents/" + side, new AgentMessage(side, activity.agentName(),
                activity.usage().requests(), activity.usage().errors(), activity.usage().totalLatencyMs(),
                activity.usage().averageLatencyMs(), activity.hallucinations(),
                activity.hallucinationCeiling(), activity.hallucinationTotal()));
    }

    @Override
    public void onGameOver(MatchResult result) {
        submit("result", new ResultMessage(result.outcome().name(), result.reason().name(),
                result.outcome().score()));
    }

    String topic(String suffix) {
        return prefix + "/" + suffix;
    }

    private void submit(String suffix, Object payload) {
        String topic = topic(suffix);
        try {
            executor.submit(() -> publish(topic, payload));
        } catch (RejectedExecutionException e) {
            logger.debug("Telemetry publisher closed, dropping message for {}", topic);
        }
    }

    private void publish(String topic, Object payload) {
        if (!sink.isConnected()) {
            logger.debug("Telemetry sink not connected, dropping message for {}", topic);
            return;
        }
        try {
            sink.publish(topic, payload);
        } catch (MqttException e) {
            logger.warn("Failed to publish telemetry to {}: {}", topic, e.getMessage());
        }
    }

    private static String sideName(PieceColor side) {
        return side == null ? null : side.name().toLowerCase();
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
