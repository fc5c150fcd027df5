package org.chessarena.agent;

import org.chessarena.settings.EngineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Agent backed by a local UCI engine. The position is read from the
 * {@code Position (FEN):} line of the prompt and the engine's best move is
 * answered in the labelled reply format, in coordinate notation.
 */
public class UciEngineAgent implements MoveAgent {
    private static final Logger logger = LoggerFactory.getLogger(UciEngineAgent.class);
    private static final Pattern FEN_LINE = Pattern.compile("Position \\(FEN\\):\\s*([^\\n]+)");

    private final String name;
    private final ChessEngine engine;
    private final EngineSettings settings;
    private final ExecutorService executor;

    public UciEngineAgent(String name, EngineSettings settings) {
        this(name, new ChessEngine(settings.getStockfishPath()), settings);
    }

    UciEngineAgent(String name, ChessEngine engine, EngineSettings settings) {
        this.name = name;
        this.engine = engine;
        this.settings = settings;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "uci-engine-thread");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CompletableFuture<String> requestMove(String prompt) {
        CompletableFuture<String> future = new CompletableFuture<>();
        Matcher matcher = FEN_LINE.matcher(prompt == null ? "" : prompt);
        if (!matcher.find()) {
            future.completeExceptionally(new AgentException("Prompt does not contain a FEN position line"));
            return future;
        }
        String fen = matcher.group(1).trim();

        executor.submit(() -> {
            if (future.isDone()) {
                return;
            }
            try {
                ensureReady();
                EngineAnalysisResult result = engine.analyzePosition(fen, settings.getThinkingTimeMs());
                if (result == null || !result.hasMove()) {
                    future.completeExceptionally(new AgentException("Engine returned no move for " + fen));
                    return;
                }
                String evaluation = result.evaluation() == null ? "unknown" : result.evaluation();
                future.complete("MOVE: " + result.bestMove() + "\nTHOUGHT: Engine evaluation " + evaluation);
            } catch (AgentException e) {
                future.completeExceptionally(e);
            } catch (RuntimeException e) {
                logger.error("Exception during engine analysis", e);
                future.completeExceptionally(new AgentException("Engine analysis failed: " + e.getMessage(), e));
            }
        });
        return future;
    }

    private void ensureReady() throws AgentException {
        if (engine.isInitialized()) {
            return;
        }
        if (!engine.initialize()) {
            throw new AgentException("Failed to initialize UCI engine");
        }
        logger.debug("Configuring engine options: skill={}, threads={}, hash={}MB",
                settings.getSkillLevel(), settings.getThreads(), settings.getHashSizeMB());
        try {
            engine.setOption("Skill Level", String.valueOf(settings.getSkillLevel()));
            engine.setOption("Threads", String.valueOf(settings.getThreads()));
            engine.setOption("Hash", String.valueOf(settings.getHashSizeMB()));
        } catch (IOException e) {
            throw new AgentException("Failed to configure UCI engine: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        logger.info("Closing engine agent {}", name);
        engine.shutdown();
        executor.shutdownNow();
    }
}
