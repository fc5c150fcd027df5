package org.chessarena.telemetry;

import org.eclipse.paho.client.mqttv3.MqttException;

/**
 * Destination for telemetry messages; payloads are serialized to JSON.
 */
public interface TelemetrySink {

    boolean isConnected();

    void publish(String topic, Object payload) throws MqttException;
}
