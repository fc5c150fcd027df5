package org.chessarena.settings;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class SettingsManager {
    private static final Logger logger = LoggerFactory.getLogger(SettingsManager.class);
    private static final String SETTINGS_FILE = "settings.json";

    private final Gson gson;
    private final Path settingsPath;
    private AppSettings settings;

    public SettingsManager() {
        this(defaultPath());
    }

    public SettingsManager(Path settingsPath) {
        logger.info("Initializing SettingsManager");
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        this.settingsPath = settingsPath;
        logger.debug("Settings path: {}", settingsPath);
        load();
    }

    public static Path defaultPath() {
        return Paths.get(System.getProperty("user.home"), ".chess-arena", SETTINGS_FILE);
    }

    public AppSettings getSettings() {
        return settings;
    }

    public Path getSettingsPath() {
        return settingsPath;
    }

    public void load() {
        logger.debug("Loading settings from {}", settingsPath);
        try {
            if (Files.exists(settingsPath)) {
                String json = Files.readString(settingsPath);
                settings = gson.fromJson(json, AppSettings.class);
                if (settings == null) {
                    logger.warn("Settings file exists but is empty, using defaults");
                    settings = new AppSettings();
                }
                logger.info("Settings loaded successfully");
            } else {
                logger.info("Settings file not found, creating with defaults");
                settings = new AppSettings();
                save();
            }
        } catch (IOException | JsonParseException e) {
            logger.error("Failed to load settings, using defaults", e);
            settings = new AppSettings();
        }
        ensureNonNullSections();
    }

    public void save() {
        logger.debug("Saving settings to {}", settingsPath);
        try {
            Path parent = settingsPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(settingsPath, gson.toJson(settings));
            logger.info("Settings saved successfully");
        } catch (IOException e) {
            logger.error("Failed to save settings", e);
        }
    }

    public void reset() {
        logger.info("Resetting settings to defaults");
        settings = new AppSettings();
        save();
    }

    private void ensureNonNullSections() {
        if (settings.getMatch() == null) {
            settings.setMatch(new MatchSettings());
        }
        if (settings.getWhite() == null) {
            settings.setWhite(AgentSettings.defaults("White Agent", AgentSettings.PROVIDER_OPENAI));
        }
        if (settings.getBlack() == null) {
            settings.setBlack(AgentSettings.defaults("Black Agent", AgentSettings.PROVIDER_GROQ));
        }
        if (settings.getEngine() == null) {
            settings.setEngine(new EngineSettings());
        }
        if (settings.getMqtt() == null) {
            settings.setMqtt(new MqttSettings());
        }
    }
}
