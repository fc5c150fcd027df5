package org.chessarena.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Line-oriented UCI session with an engine process such as Stockfish.
 */
public class ChessEngine {
    private static final Logger logger = LoggerFactory.getLogger(ChessEngine.class);
    private static final long HANDSHAKE_TIMEOUT_MS = 5000;

    private final String enginePath;
    private Process engineProcess;
    private BufferedReader reader;
    private BufferedWriter writer;
    private boolean initialized = false;

    public ChessEngine(String enginePath) {
        this.enginePath = enginePath;
    }

    /** Attaches to already open streams; used to drive a scripted engine. */
    ChessEngine(BufferedReader reader, BufferedWriter writer) {
        this.enginePath = "<streams>";
        this.reader = reader;
        this.writer = writer;
    }

    public boolean initialize() {
        logger.info("Initializing UCI engine at: {}", enginePath);
        try {
            if (engineProcess == null && reader == null) {
                ProcessBuilder pb = new ProcessBuilder(enginePath);
                engineProcess = pb.start();
                reader = new BufferedReader(new InputStreamReader(engineProcess.getInputStream(), StandardCharsets.UTF_8));
                writer = new BufferedWriter(new OutputStreamWriter(engineProcess.getOutputStream(), StandardCharsets.UTF_8));
            }

            sendCommand("uci");
            if (readUntil("uciok").contains("uciok")) {
                sendCommand("isready");
                if (readUntil("readyok").contains("readyok")) {
                    initialized = true;
                    logger.info("UCI engine initialized successfully");
                    return true;
                }
            }
            logger.error("UCI engine initialization failed: did not receive expected responses");
        } catch (IOException e) {
            logger.error("Failed to initialize UCI engine: {}", e.getMessage(), e);
        }
        return false;
    }

    public synchronized EngineAnalysisResult analyzePosition(String fen, int thinkingTimeMs) {
        if (!initialized) {
            logger.warn("Analysis requested but engine is not initialized");
            return EngineAnalysisResult.empty();
        }

        logger.debug("Analyzing {} for {}ms", fen, thinkingTimeMs);
        try {
            sendCommand("position fen " + fen);
            sendCommand("go movetime " + thinkingTimeMs);

            String line;
            String bestMove = null;
            String evaluation = null;
            while ((line = reader.readLine()) != null) {
                if (line.startsWith("info") && line.contains("score")) {
                    String parsedScore = parseEvaluation(line);
                    if (parsedScore != null) {
                        evaluation = parsedScore;
                    }
                } else if (line.startsWith("bestmove")) {
                    String[] parts = line.split(" ");
                    if (parts.length >= 2) {
                        bestMove = parts[1];
                    }
                    break;
                }
            }

            logger.debug("Analysis complete: bestMove={}, evaluation={}", bestMove, evaluation);
            return new EngineAnalysisResult(bestMove, evaluation);
        } catch (IOException e) {
            logger.error("Error analyzing position", e);
            return EngineAnalysisResult.empty();
        }
    }

    public synchronized void setOption(String name, String value) throws IOException {
        sendCommand("setoption name " + name + " value " + value);
    }

    private void sendCommand(String command) throws IOException {
        writer.write(command + "\n");
        writer.flush();
    }

    String parseEvaluation(String line) {
        String[] parts = line.split(" ");
        for (int i = 0; i < parts.length; i++) {
            if ("score".equals(parts[i]) && i + 2 < parts.length) {
                String type = parts[i + 1];
                String rawValue = parts[i + 2];
                if ("cp".equals(type)) {
                    try {
                        double centipawns = Double.parseDouble(rawValue);
                        return String.format(Locale.ROOT, "%.2f", centipawns / 100.0);
                    } catch (NumberFormatException e) {
                        logger.debug("Unreadable centipawn score in: {}", line);
                        return null;
                    }
                } else if ("mate".equals(type)) {
                    return "Mate in " + rawValue;
                }
            }
        }
        return null;
    }

    private String readUntil(String marker) throws IOException {
        StringBuilder response = new StringBuilder();
        String line;
        long startTime = System.currentTimeMillis();

        while ((line = reader.readLine()) != null) {
            response.append(line).append("\n");
            if (line.contains(marker)) {
                break;
            }
            if (System.currentTimeMillis() - startTime > HANDSHAKE_TIMEOUT_MS) {
                break;
            }
        }
        return response.toString();
    }

    public void shutdown() {
        logger.info("Shutting down UCI engine");
        try {
            if (writer != null) {
                sendCommand("quit");
                writer.close();
            }
            if (reader != null) {
                reader.close();
            }
            if (engineProcess != null) {
                engineProcess.waitFor(2, TimeUnit.SECONDS);
                if (engineProcess.isAlive()) {
                    logger.warn("Engine process did not terminate gracefully, forcing shutdown");
                    engineProcess.destroyForcibly();
                }
            }
            logger.info("UCI engine shutdown complete");
        } catch (IOException e) {
            logger.error("Error shutting down UCI engine", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for the engine to exit");
        }
        initialized = false;
    }

    public boolean isInitialized() {
        return initialized;
    }
}
