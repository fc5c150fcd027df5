package org.chessarena.settings;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SettingsManagerTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileIsCreatedWithDefaults() {
        Path file = tempDir.resolve("nested").resolve("settings.json");

        SettingsManager manager = new SettingsManager(file);

        assertTrue(Files.exists(file));
        AppSettings settings = manager.getSettings();
        assertEquals(2, settings.getMatch().getHallucinationCeiling());
        assertEquals("White Agent", settings.getWhite().getName());
        assertEquals(AgentSettings.PROVIDER_GROQ, settings.getBlack().getProviderType());
        assertEquals("https://api.groq.com/openai/v1", settings.getBlack().getBaseUrl());
        assertFalse(settings.getMqtt().isPublishTelemetry());
    }

    @Test
    void savedChangesAreReloaded() {
        Path file = tempDir.resolve("settings.json");
        SettingsManager manager = new SettingsManager(file);
        manager.getSettings().getMatch().setHallucinationCeiling(4);
        manager.getSettings().getWhite().setModel("gpt-4o-mini");
        manager.getSettings().getEngine().setStockfishPath("/opt/stockfish");
        manager.save();

        AppSettings reloaded = new SettingsManager(file).getSettings();

        assertEquals(4, reloaded.getMatch().getHallucinationCeiling());
        assertEquals("gpt-4o-mini", reloaded.getWhite().getModel());
        assertEquals("/opt/stockfish", reloaded.getEngine().getStockfishPath());
    }

    @Test
    void partialFileKeepsDefaultsForMissingSections() throws IOException {
        Path file = tempDir.resolve("settings.json");
        Files.writeString(file, "{\"match\": {\"turnDelayMs\": 250}}");

        AppSettings settings = new SettingsManager(file).getSettings();

        assertEquals(250, settings.getMatch().getTurnDelayMs());
        assertEquals(60000, settings.getMatch().getRequestTimeoutMs());
        assertNotNull(settings.getWhite());
        assertNotNull(settings.getMqtt());
        assertEquals(1883, settings.getMqtt().getPort());
    }

    @Test
    void explicitNullSectionsAreFilledIn() throws IOException {
        Path file = tempDir.resolve("settings.json");
        Files.writeString(file, "{\"white\": null, \"engine\": null}");

        AppSettings settings = new SettingsManager(file).getSettings();

        assertEquals("White Agent", settings.getWhite().getName());
        assertNotNull(settings.getEngine());
    }

    @Test
    void corruptFileFallsBackToDefaults() throws IOException {
        Path file = tempDir.resolve("settings.json");
        Files.writeString(file, "{ this is not json");

        AppSettings settings = new SettingsManager(file).getSettings();

        assertEquals(new AppSettings(), settings);
    }

    @Test
    void resetRestoresDefaults() {
        Path file = tempDir.resolve("settings.json");
        SettingsManager manager = new SettingsManager(file);
        manager.getSettings().getMatch().setTurnDelayMs(1);

        manager.reset();

        assertEquals(1500, manager.getSettings().getMatch().getTurnDelayMs());
        assertEquals(1500, new SettingsManager(file).getSettings().getMatch().getTurnDelayMs());
    }
}
