package org.chessarena.settings;

import lombok.Data;

@Data
public class EngineSettings {
    private String stockfishPath = "";
    private int thinkingTimeMs = 1000;
    private int skillLevel = 20;
    private int threads = 1;
    private int hashSizeMB = 128;
}
