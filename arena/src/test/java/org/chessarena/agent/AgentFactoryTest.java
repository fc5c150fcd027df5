package org.chessarena.agent;

import org.chessarena.settings.AgentSettings;
import org.chessarena.settings.EngineSettings;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AgentFactoryTest {

    private final EngineSettings engineSettings = new EngineSettings();
    private final AgentFactory factory = new AgentFactory(engineSettings);

    @Test
    void chatProvidersUseChatCompletionAgent() {
        for (String type : new String[]{AgentSettings.PROVIDER_OPENAI, AgentSettings.PROVIDER_GROQ,
                AgentSettings.PROVIDER_XAI, AgentSettings.PROVIDER_OLLAMA, AgentSettings.PROVIDER_CUSTOM}) {
            MoveAgent agent = factory.create(AgentSettings.defaults("A", type));

            assertInstanceOf(ChatCompletionAgent.class, agent, type);
            assertEquals("A", agent.name());
        }
    }

    @Test
    void stockfishNeedsAConfiguredPath() {
        AgentSettings settings = AgentSettings.defaults("Fish", AgentSettings.PROVIDER_STOCKFISH);

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> factory.create(settings));
        assertEquals("Stockfish path is not configured.", error.getMessage());

        engineSettings.setStockfishPath("/usr/bin/stockfish");
        try (MoveAgent agent = factory.create(settings)) {
            assertInstanceOf(UciEngineAgent.class, agent);
        }
    }

    @Test
    void unknownProviderIsRejected() {
        AgentSettings settings = AgentSettings.defaults("X", AgentSettings.PROVIDER_OPENAI);
        settings.setProviderType("carrier-pigeon");

        assertThrows(IllegalArgumentException.class, () -> factory.create(settings));
    }

    @Test
    void providerTypeIsCaseInsensitive() {
        AgentSettings settings = AgentSettings.defaults("G", AgentSettings.PROVIDER_GROQ);
        settings.setProviderType("GROQ");

        assertInstanceOf(ChatCompletionAgent.class, factory.create(settings));
    }
}
