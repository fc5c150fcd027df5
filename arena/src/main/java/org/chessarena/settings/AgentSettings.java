package org.chessarena.settings;

import lombok.Data;

import java.util.Locale;

/**
 * Connection and persona settings for one side's agent.
 */
@Data
public class AgentSettings {
    public static final String PROVIDER_OPENAI = "openai";
    public static final String PROVIDER_GROQ = "groq";
    public static final String PROVIDER_XAI = "xai";
    public static final String PROVIDER_OLLAMA = "ollama";
    public static final String PROVIDER_CUSTOM = "custom";
    public static final String PROVIDER_STOCKFISH = "stockfish";

    private static final String DEFAULT_SYSTEM_PROMPT =
            "You are a competitive chess player. Play strong, legal moves and keep your commentary short.";

    private String name = "Agent";
    private String providerType = PROVIDER_OPENAI;
    private String baseUrl = "https://api.openai.com/v1";
    private String apiKey = "";
    private String model = "gpt-4o";
    private double temperature = 0.8;
    private double topP = 0.9;
    private int maxTokens = 500;
    private String systemPrompt = DEFAULT_SYSTEM_PROMPT;

    public static AgentSettings defaults(String name, String providerType) {
        AgentSettings settings = new AgentSettings();
        settings.setName(name);
        settings.applyProviderDefaults(providerType);
        return settings;
    }

    /** Switches the provider and resets base URL and model to that provider's defaults. */
    public void applyProviderDefaults(String type) {
        String normalized = type == null ? PROVIDER_CUSTOM : type.toLowerCase(Locale.ROOT);
        this.providerType = normalized;
        switch (normalized) {
            case PROVIDER_OPENAI -> {
                baseUrl = "https://api.openai.com/v1";
                model = "gpt-4o";
            }
            case PROVIDER_GROQ -> {
                baseUrl = "https://api.groq.com/openai/v1";
                model = "llama-3.3-70b-versatile";
            }
            case PROVIDER_XAI -> {
                baseUrl = "https://api.x.ai/v1";
                model = "grok-beta";
            }
            case PROVIDER_OLLAMA -> {
                baseUrl = "http://localhost:11434/v1";
                model = "llama3";
            }
            case PROVIDER_STOCKFISH -> {
                baseUrl = "";
                model = "stockfish";
            }
            default -> {
                // custom endpoints keep whatever was configured
            }
        }
    }
}
