package org.chessarena;

import org.chessarena.agent.AgentFactory;
import org.chessarena.agent.AgentReplyParser;
import org.chessarena.agent.MoveAgent;
import org.chessarena.console.ConsoleMatchView;
import org.chessarena.console.DirectorConsole;
import org.chessarena.match.MatchOrchestrator;
import org.chessarena.prompt.ArenaPromptBuilder;
import org.chessarena.rules.RuleEngine;
import org.chessarena.settings.AppSettings;
import org.chessarena.settings.MqttSettings;
import org.chessarena.settings.SettingsManager;
import org.chessarena.telemetry.MqttTelemetryPublisher;
import org.chessarena.telemetry.TelemetryBrokerService;
import org.chessarena.telemetry.TelemetryMqttClient;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws IOException {
        logger.info("Chess Arena starting...");
        SettingsManager settingsManager = args.length > 0
                ? new SettingsManager(Paths.get(args[0]))
                : new SettingsManager();
        AppSettings settings = settingsManager.getSettings();

        AgentFactory agentFactory = new AgentFactory(settings.getEngine());
        TelemetryBrokerService broker = new TelemetryBrokerService();
        TelemetryMqttClient telemetryClient = new TelemetryMqttClient();
        MqttTelemetryPublisher publisher = null;

        try (MoveAgent white = agentFactory.create(settings.getWhite());
             MoveAgent black = agentFactory.create(settings.getBlack());
             MatchOrchestrator orchestrator = new MatchOrchestrator(
                     new RuleEngine(settings.getMatch().isDefaultPromotionToQueen()),
                     new ArenaPromptBuilder(settings.getWhite(), settings.getBlack()),
                     new AgentReplyParser(),
                     white,
                     black,
                     settings.getMatch())) {

            ConsoleMatchView view = new ConsoleMatchView(System.out, false);
            orchestrator.addListener(view);
            publisher = startTelemetry(settings.getMqtt(), broker, telemetryClient);
            if (publisher != null) {
                orchestrator.addListener(publisher);
            }

            DirectorConsole console = new DirectorConsole(orchestrator, view, System.out);
            console.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        } finally {
            if (publisher != null) {
                publisher.close();
            }
            telemetryClient.disconnect();
            broker.shutdown();
            logger.info("Chess Arena stopped");
        }
    }

    private static MqttTelemetryPublisher startTelemetry(MqttSettings mqtt,
                                                         TelemetryBrokerService broker,
                                                         TelemetryMqttClient client) {
        try {
            TelemetryBrokerService.BrokerStatus status = broker.applySettings(mqtt);
            logger.info("Telemetry broker: {}", status.change());
        } catch (IllegalStateException e) {
            logger.error("Telemetry broker unavailable: {}", e.getMessage());
        }
        if (!mqtt.isPublishTelemetry()) {
            return null;
        }
        try {
            client.connect(mqtt, "chess-arena-host");
            return new MqttTelemetryPublisher(client, mqtt.getTopicPrefix());
        } catch (MqttException e) {
            logger.error("Telemetry publishing disabled: {}", e.getMessage(), e);
            return null;
        }
    }
}
