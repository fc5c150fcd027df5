package org.chessarena.telemetry;

import org.chessarena.settings.MqttSettings;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TelemetryMqttClientTest {

    record Ping(String fen, int moveNumber) {
    }

    @TempDir
    Path tempDir;

    private TelemetryBrokerService broker;
    private final TelemetryMqttClient client = new TelemetryMqttClient();
    private MqttClient viewer;
    private MqttSettings settings;

    @BeforeEach
    void startBroker() throws IOException {
        settings = new MqttSettings();
        settings.setBrokerEnabled(true);
        settings.setHost("127.0.0.1");
        settings.setPort(freePort());
        broker = new TelemetryBrokerService(tempDir);
        broker.applySettings(settings);
    }

    @AfterEach
    void stopBroker() throws MqttException {
        if (viewer != null) {
            if (viewer.isConnected()) {
                viewer.disconnect();
            }
            viewer.close();
        }
        client.close();
        broker.shutdown();
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    @Test
    void retainedMessageReachesLateSubscriber() throws Exception {
        client.connect(settings, "arena-test-publisher");
        assertTrue(client.isConnected());

        client.publish("arena-test/position", new Ping("8/8/8/8/8/8/8/K6k w - - 0 1", 12));

        BlockingQueue<MqttMessage> received = new LinkedBlockingQueue<>();
        viewer = new MqttClient(settings.clientUrl(), "arena-test-viewer", new MemoryPersistence());
        viewer.connect();
        viewer.subscribe("arena-test/#", 1, (topic, message) -> received.add(message));

        MqttMessage message = received.poll(5, TimeUnit.SECONDS);
        assertNotNull(message, "retained telemetry was not delivered");
        assertTrue(message.isRetained());
        assertEquals("{\"fen\":\"8/8/8/8/8/8/8/K6k w - - 0 1\",\"moveNumber\":12}",
                new String(message.getPayload(), StandardCharsets.UTF_8));
    }

    @Test
    void publishWithoutConnectionFails() {
        MqttException error = assertThrows(MqttException.class, () -> client.publish("arena-test/status", "x"));

        assertEquals(MqttException.REASON_CODE_CLIENT_NOT_CONNECTED, error.getReasonCode());
        assertFalse(client.isConnected());
    }

    @Test
    void disconnectIsIdempotent() throws MqttException {
        client.connect(settings, "arena-test-publisher");

        client.disconnect();
        client.disconnect();

        assertFalse(client.isConnected());
    }

    @Test
    void credentialsAreOnlySentWhenConfigured() {
        assertNull(TelemetryMqttClient.connectOptions("", "ignored").getUserName());
        assertEquals("director", TelemetryMqttClient.connectOptions("director", null).getUserName());
        assertEquals(0, TelemetryMqttClient.connectOptions("director", null).getPassword().length);
    }
}
