package org.chessarena.telemetry;

import io.moquette.broker.Server;
import io.moquette.broker.config.IConfig;
import io.moquette.broker.config.MemoryConfig;
import io.moquette.broker.security.IAuthenticator;
import io.moquette.broker.security.PermitAllAuthorizatorPolicy;
import io.moquette.interception.InterceptHandler;
import org.chessarena.settings.MqttSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.Objects;
import java.util.Properties;

/**
 * Embedded Moquette broker that views and dashboards subscribe to for match
 * telemetry.
 */
public class TelemetryBrokerService {
    private static final Logger logger = LoggerFactory.getLogger(TelemetryBrokerService.class);

    private static final String PROP_PORT = "port";
    private static final String PROP_HOST = "host";
    private static final String PROP_ALLOW_ANONYMOUS = "allow_anonymous";
    private static final String PROP_NEED_CLIENT_AUTH = "need_client_auth";
    private static final String PROP_DATA_PATH = "data_path";
    private static final String PROP_PERSISTENCE_ENABLED = "persistence_enabled";
    private static final String PROP_PERSISTENT_CLIENT_EXPIRATION = "persistent_client_expiration";
    private static final String PROP_WS_ENABLED = "websocket_enabled";
    private static final String PROP_WS_PORT = "websocket_port";
    private static final String PROP_WS_PATH = "websocket_path";
    private static final String MISSING_EXPIRY_MESSAGE = "without expiry instant";

    public enum BrokerChange {
        STARTED,
        RESTARTED,
        STOPPED,
        NO_CHANGE
    }

    public record RuntimeInfo(String host, int port, boolean websocketEnabled, int websocketPort) { }

    public record BrokerStatus(BrokerChange change, RuntimeInfo runtimeInfo) { }

    private final Path dataDir;
    private Server server;
    private boolean running;
    private RuntimeInfo runtimeInfo;
    private MqttSettings cachedSettings;

    public TelemetryBrokerService() {
        this(Paths.get(System.getProperty("user.home"), ".chess-arena", "mqtt"));
    }

    public TelemetryBrokerService(Path dataDir) {
        this.dataDir = dataDir;
    }

    public synchronized BrokerStatus applySettings(MqttSettings settings) {
        logger.debug("Applying MQTT broker settings");
        if (settings == null || !settings.isBrokerEnabled()) {
            if (running) {
                logger.info("Stopping MQTT broker (disabled by settings)");
                stopInternal();
                return new BrokerStatus(BrokerChange.STOPPED, null);
            }
            return new BrokerStatus(BrokerChange.NO_CHANGE, null);
        }

        MqttSettings snapshot = settings.copy();
        if (running && Objects.equals(snapshot, cachedSettings)) {
            logger.debug("MQTT broker settings unchanged");
            return new BrokerStatus(BrokerChange.NO_CHANGE, runtimeInfo);
        }

        BrokerChange change = running ? BrokerChange.RESTARTED : BrokerChange.STARTED;
        if (running) {
            logger.info("Restarting MQTT broker with new settings");
            stopInternal();
        }

        startInternal(snapshot);
        cachedSettings = snapshot;
        return new BrokerStatus(change, runtimeInfo);
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public synchronized RuntimeInfo getRuntimeInfo() {
        return runtimeInfo;
    }

    public synchronized void shutdown() {
        logger.info("Shutting down MQTT broker service");
        stopInternal();
    }

    private void startInternal(MqttSettings settings) {
        logger.info("Starting MQTT broker on {}:{}", settings.getHost(), settings.getPort());
        try {
            Properties props = buildProperties(settings, dataDir);
            try {
                launch(props, settings);
            } catch (IOException | RuntimeException ex) {
                if (!isMissingExpiryException(ex)) {
                    throw ex;
                }
                logger.warn("Persisted broker sessions lack an expiry, starting without persistence");
                stopInternal();
                props.setProperty(PROP_PERSISTENCE_ENABLED, Boolean.FALSE.toString());
                launch(props, settings);
            }
            running = true;
            runtimeInfo = new RuntimeInfo(settings.getHost(), settings.getPort(),
                    settings.isWebsocketEnabled(), settings.getWebsocketPort());
            logger.info("MQTT broker started successfully");
        } catch (IOException | RuntimeException ex) {
            logger.error("Failed to start MQTT broker", ex);
            stopInternal();
            throw new IllegalStateException("Failed to start MQTT broker: " + ex.getMessage(), ex);
        }
    }

    private void launch(Properties props, MqttSettings settings) throws IOException {
        IConfig config = new MemoryConfig(props);
        server = new Server();
        IAuthenticator authenticator = settings.isAllowAnonymous() ? null : buildAuthenticator(settings);
        server.startServer(config, Collections.<InterceptHandler>emptyList(), null, authenticator,
                new PermitAllAuthorizatorPolicy());
    }

    private void stopInternal() {
        if (server != null) {
            logger.debug("Stopping MQTT broker");
            try {
                server.stopServer();
                logger.info("MQTT broker stopped");
            } catch (RuntimeException e) {
                logger.warn("Exception while stopping MQTT broker", e);
            }
        }
        server = null;
        running = false;
        runtimeInfo = null;
        cachedSettings = null;
    }

    Properties buildProperties(MqttSettings settings, Path brokerDir) throws IOException {
        Properties props = new Properties();
        props.setProperty(PROP_PORT, String.valueOf(settings.getPort()));
        props.setProperty(PROP_HOST, settings.getHost());
        props.setProperty(PROP_ALLOW_ANONYMOUS, String.valueOf(settings.isAllowAnonymous()));
        props.setProperty(PROP_NEED_CLIENT_AUTH, String.valueOf(!settings.isAllowAnonymous()));

        Files.createDirectories(brokerDir);
        props.setProperty(PROP_DATA_PATH, brokerDir.toString().replace("\\", "/"));
        props.setProperty(PROP_PERSISTENCE_ENABLED, Boolean.TRUE.toString());
        props.setProperty(PROP_PERSISTENT_CLIENT_EXPIRATION, Integer.MAX_VALUE + "s");

        if (settings.isWebsocketEnabled()) {
            props.setProperty(PROP_WS_ENABLED, Boolean.TRUE.toString());
            props.setProperty(PROP_WS_PORT, String.valueOf(settings.getWebsocketPort()));
            props.setProperty(PROP_WS_PATH, "/mqtt");
        } else {
            props.setProperty(PROP_WS_ENABLED, Boolean.FALSE.toString());
        }
        return props;
    }

    /** Moquette refuses to restore sessions persisted without an expiry instant. */
    boolean isMissingExpiryException(Throwable error) {
        Throwable current = error;
        while (current != null) {
            String message = current.getMessage();
            if (message != null && message.contains(MISSING_EXPIRY_MESSAGE)) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    IAuthenticator buildAuthenticator(MqttSettings settings) {
        String expectedUser = settings.getUsername();
        String expectedPassword = settings.getPassword();
        if (expectedUser == null || expectedUser.isBlank()) {
            throw new IllegalArgumentException("Username must be provided when anonymous access is disabled.");
        }
        return (clientId, username, password) -> {
            if (username == null || !expectedUser.equals(username)) {
                return false;
            }
            String providedPassword = password == null ? "" : new String(password, StandardCharsets.UTF_8);
            return Objects.equals(expectedPassword, providedPassword);
        };
    }
}
