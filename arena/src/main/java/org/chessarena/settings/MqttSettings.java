package org.chessarena.settings;

import lombok.Data;

@Data
public class MqttSettings {
    private boolean brokerEnabled = false;
    private String host = "0.0.0.0";
    private int port = 1883;
    private boolean websocketEnabled = false;
    private int websocketPort = 8083;
    private boolean allowAnonymous = true;
    private String username = "";
    private String password = "";
    private boolean publishTelemetry = false;
    private String topicPrefix = "chess-arena";

    public MqttSettings copy() {
        MqttSettings copy = new MqttSettings();
        copy.setBrokerEnabled(brokerEnabled);
        copy.setHost(host);
        copy.setPort(port);
        copy.setWebsocketEnabled(websocketEnabled);
        copy.setWebsocketPort(websocketPort);
        copy.setAllowAnonymous(allowAnonymous);
        copy.setUsername(username);
        copy.setPassword(password);
        copy.setPublishTelemetry(publishTelemetry);
        copy.setTopicPrefix(topicPrefix);
        return copy;
    }

    /** Address a local client uses to reach the broker described here. */
    public String clientUrl() {
        String target = host == null || host.isBlank() || "0.0.0.0".equals(host) ? "localhost" : host;
        return "tcp://" + target + ":" + port;
    }
}
