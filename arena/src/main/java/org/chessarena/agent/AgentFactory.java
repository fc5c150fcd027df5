package org.chessarena.agent;

import org.chessarena.settings.AgentSettings;
import org.chessarena.settings.EngineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Builds the agent for one side from its settings.
 */
public class AgentFactory {
    private static final Logger logger = LoggerFactory.getLogger(AgentFactory.class);

    private final EngineSettings engineSettings;

    public AgentFactory(EngineSettings engineSettings) {
        this.engineSettings = engineSettings;
    }

    public MoveAgent create(AgentSettings settings) {
        String type = settings.getProviderType() == null
                ? AgentSettings.PROVIDER_CUSTOM
                : settings.getProviderType().toLowerCase(Locale.ROOT);
        logger.info("Creating {} agent '{}'", type, settings.getName());
        return switch (type) {
            case AgentSettings.PROVIDER_STOCKFISH -> {
                String path = engineSettings.getStockfishPath();
                if (path == null || path.isBlank()) {
                    throw new IllegalArgumentException("Stockfish path is not configured.");
                }
                yield new UciEngineAgent(settings.getName(), engineSettings);
            }
            case AgentSettings.PROVIDER_OPENAI, AgentSettings.PROVIDER_GROQ, AgentSettings.PROVIDER_XAI,
                 AgentSettings.PROVIDER_OLLAMA, AgentSettings.PROVIDER_CUSTOM -> new ChatCompletionAgent(settings);
            default -> throw new IllegalArgumentException("Unknown provider type: " + settings.getProviderType());
        };
    }
}
