package org.chessarena.settings;

import lombok.Data;

@Data
public class AppSettings {
    private MatchSettings match = new MatchSettings();
    private AgentSettings white = AgentSettings.defaults("White Agent", AgentSettings.PROVIDER_OPENAI);
    private AgentSettings black = AgentSettings.defaults("Black Agent", AgentSettings.PROVIDER_GROQ);
    private EngineSettings engine = new EngineSettings();
    private MqttSettings mqtt = new MqttSettings();
}
