package org.chessarena.telemetry;

import com.google.gson.Gson;
import org.chessarena.settings.MqttSettings;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Publish-only MQTT connection for match telemetry. Every message is JSON,
 * sent with QoS 1 and retained, so a viewer that subscribes late still sees
 * the latest value of each topic.
 */
public class TelemetryMqttClient implements TelemetrySink, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TelemetryMqttClient.class);
    private static final int QOS = 1;

    private final Gson gson = new Gson();
    private MqttClient mqttClient;
    private volatile boolean connected;

    /** Connects to the broker described by the settings, with their credentials when present. */
    public void connect(MqttSettings settings, String clientId) throws MqttException {
        connect(settings.clientUrl(), clientId, settings.getUsername(), settings.getPassword());
    }

    public synchronized void connect(String brokerUrl, String clientId, String username, String password)
            throws MqttException {
        if (isConnected()) {
            logger.debug("Telemetry client already connected to {}", mqttClient.getServerURI());
            return;
        }
        logger.info("Connecting telemetry client {} to {}", clientId, brokerUrl);
        MqttClient client = new MqttClient(brokerUrl, clientId, new MemoryPersistence());
        client.setCallback(new MqttCallbackExtended() {
            @Override
            public void connectComplete(boolean reconnect, String serverUri) {
                connected = true;
                if (reconnect) {
                    logger.info("Telemetry client reconnected to {}", serverUri);
                }
            }

            @Override
            public void connectionLost(Throwable cause) {
                logger.warn("Telemetry connection lost: {}", cause == null ? "unknown" : cause.getMessage());
                connected = false;
            }

            @Override
            public void messageArrived(String topic, MqttMessage message) {
                logger.debug("Ignoring message on {}", topic);
            }

            @Override
            public void deliveryComplete(IMqttDeliveryToken token) {
            }
        });

        client.connect(connectOptions(username, password));
        mqttClient = client;
        connected = true;
        logger.info("Telemetry client connected");
    }

    static MqttConnectOptions connectOptions(String username, String password) {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setCleanSession(true);
        options.setAutomaticReconnect(true);
        options.setConnectionTimeout(10);
        options.setKeepAliveInterval(60);
        if (username != null && !username.isBlank()) {
            options.setUserName(username);
            options.setPassword(password == null ? new char[0] : password.toCharArray());
        }
        return options;
    }

    @Override
    public boolean isConnected() {
        MqttClient client = mqttClient;
        return connected && client != null && client.isConnected();
    }

    @Override
    public void publish(String topic, Object payload) throws MqttException {
        MqttClient client = mqttClient;
        if (client == null || !isConnected()) {
            throw new MqttException(MqttException.REASON_CODE_CLIENT_NOT_CONNECTED);
        }
        String json = gson.toJson(payload);
        logger.debug("Publishing to {}: {}", topic, json);
        client.publish(topic, json.getBytes(StandardCharsets.UTF_8), QOS, true);
    }

    public synchronized void disconnect() {
        MqttClient client = mqttClient;
        mqttClient = null;
        connected = false;
        if (client == null) {
            return;
        }
        try {
            if (client.isConnected()) {
                logger.info("Disconnecting telemetry client");
                client.disconnect();
            }
            client.close();
        } catch (MqttException e) {
            logger.error("Error closing telemetry client", e);
        }
    }

    @Override
    public void close() {
        disconnect();
    }
}
