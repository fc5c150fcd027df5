package org.chessarena.match;

import org.chessarena.agent.AgentReply;
import org.chessarena.agent.AgentReplyParser;
import org.chessarena.agent.MoveAgent;
import org.chessarena.model.Move;
import org.chessarena.model.PieceColor;
import org.chessarena.model.Position;
import org.chessarena.prompt.PromptBuilder;
import org.chessarena.rules.FenCodec;
import org.chessarena.rules.FenFormatException;
import org.chessarena.rules.MatchResult;
import org.chessarena.rules.MoveValidation;
import org.chessarena.rules.Outcome;
import org.chessarena.rules.RuleEngine;
import org.chessarena.rules.TerminalState;
import org.chessarena.rules.TerminationReason;
import org.chessarena.settings.MatchSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives a match between two agents. Owns the canonical position, the
 * position history, the match status and the hallucination counters.
 * All state changes happen under this object's monitor; turns run on a
 * single scheduler thread, so at most one turn is in flight.
 */
public class MatchOrchestrator implements DirectorControls, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MatchOrchestrator.class);

    private final RuleEngine ruleEngine;
    private final PromptBuilder promptBuilder;
    private final AgentReplyParser replyParser;
    private final Map<PieceColor, MoveAgent> agents = new EnumMap<>(PieceColor.class);
    private final MatchSettings settings;
    private final ScheduledExecutorService executor;
    private final boolean ownsExecutor;
    private final List<MatchListener> listeners = new CopyOnWriteArrayList<>();
    private final MatchLog matchLog;
    private final HallucinationCounter counter;
    private final AgentUsageTracker usage = new AgentUsageTracker();
    private final Position initialPosition;

    private Position position;
    private final List<Position> positions = new ArrayList<>();
    private MatchStatus status = MatchStatus.IDLE;
    private MatchResult result;
    private String errorMessage;
    private String promptOverride;
    private TurnToken currentToken;
    private long turnSequence;
    private boolean inFlight;

    public MatchOrchestrator(RuleEngine ruleEngine,
                             PromptBuilder promptBuilder,
                             AgentReplyParser replyParser,
                             MoveAgent white,
                             MoveAgent black,
                             MatchSettings settings) {
        this(ruleEngine, promptBuilder, replyParser, white, black, settings, createExecutor(), true, new MatchLog());
    }

    public MatchOrchestrator(RuleEngine ruleEngine,
                             PromptBuilder promptBuilder,
                             AgentReplyParser replyParser,
                             MoveAgent white,
                             MoveAgent black,
                             MatchSettings settings,
                             ScheduledExecutorService executor) {
        this(ruleEngine, promptBuilder, replyParser, white, black, settings, executor, false, new MatchLog());
    }

    private MatchOrchestrator(RuleEngine ruleEngine,
                              PromptBuilder promptBuilder,
                              AgentReplyParser replyParser,
                              MoveAgent white,
                              MoveAgent black,
                              MatchSettings settings,
                              ScheduledExecutorService executor,
                              boolean ownsExecutor,
                              MatchLog matchLog) {
        this.ruleEngine = Objects.requireNonNull(ruleEngine, "ruleEngine");
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder");
        this.replyParser = Objects.requireNonNull(replyParser, "replyParser");
        this.agents.put(PieceColor.WHITE, Objects.requireNonNull(white, "white"));
        this.agents.put(PieceColor.BLACK, Objects.requireNonNull(black, "black"));
        this.settings = settings.copy();
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        this.matchLog = matchLog;
        this.counter = new HallucinationCounter(this.settings.effectiveCeiling());
        this.initialPosition = startPosition(this.settings.getStartFen());
        this.position = initialPosition;
        this.positions.add(initialPosition);
    }

    private static ScheduledExecutorService createExecutor() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "match-turn-thread");
            thread.setDaemon(true);
            return thread;
        });
    }

    private static Position startPosition(String fen) {
        if (fen == null || fen.isBlank()) {
            return Position.standard();
        }
        try {
            return FenCodec.parse(fen);
        } catch (FenFormatException e) {
            logger.error("Configured start position is invalid, using the standard start: {}", e.getMessage());
            return Position.standard();
        }
    }

    public void addListener(MatchListener listener) {
        listeners.add(listener);
    }

    public void removeListener(MatchListener listener) {
        listeners.remove(listener);
    }

    // Match lifecycle

    public synchronized void start() {
        requireStatus("start", MatchStatus.IDLE);
        logger.info("Starting match: {} (white) vs {} (black)",
                agents.get(PieceColor.WHITE).name(), agents.get(PieceColor.BLACK).name());
        log(LogType.SYSTEM, null, "Match started: " + agents.get(PieceColor.WHITE).name()
                + " vs " + agents.get(PieceColor.BLACK).name());
        setStatus(MatchStatus.RUNNING);
        scheduleNextTurn(0);
    }

    public synchronized void pause() {
        requireStatus("pause", MatchStatus.RUNNING);
        cancelTurn();
        log(LogType.SYSTEM, null, "Match paused");
        setStatus(MatchStatus.PAUSED);
    }

    /**
     * Continues a paused match, or retries the interrupted turn after an
     * agent fault.
     */
    public synchronized void resume() {
        requireStatus("resume", MatchStatus.PAUSED, MatchStatus.ERROR);
        errorMessage = null;
        log(LogType.SYSTEM, null, "Match resumed");
        setStatus(MatchStatus.RUNNING);
        scheduleNextTurn(0);
    }

    public synchronized void reset() {
        logger.info("Resetting match");
        cancelTurn();
        position = initialPosition;
        positions.clear();
        positions.add(initialPosition);
        matchLog.clear();
        counter.resetAll();
        usage.clear();
        promptOverride = null;
        result = null;
        errorMessage = null;
        setStatus(MatchStatus.IDLE);
        notifyPositionChanged();
        notifyAgentActivity(PieceColor.WHITE);
        notifyAgentActivity(PieceColor.BLACK);
        log(LogType.SYSTEM, null, "Match reset");
    }

    // Director controls

    @Override
    public synchronized void forceMove(String notation, PieceColor side) {
        requireStatus("force a move", MatchStatus.RUNNING, MatchStatus.PAUSED, MatchStatus.WAITING_FOR_DIRECTOR);
        PieceColor mover = position.sideToMove();
        if (side != null && side != mover) {
            logger.warn("Director tried to move for {} but it is {}'s turn", side, mover);
            throw new IllegalArgumentException("It is " + mover.displayName() + "'s turn, not " + side.displayName() + "'s");
        }

        MoveValidation validation = ruleEngine.validateMove(position, notation);
        if (!validation.legal()) {
            logger.warn("Director move {} rejected: {}", notation, validation.reason());
            throw new IllegalArgumentException(validation.reason());
        }

        cancelTurn();
        counter.reset(mover);
        notifyAgentActivity(mover);
        log(LogType.DIRECTOR, mover, "Director forced " + notation + " for " + mover.displayName());
        commitMove(validation.move(), mover, null, null, MoveRecord.Source.DIRECTOR);
        continueAfterDirector();
    }

    @Override
    public synchronized void skipTurn() {
        requireStatus("skip a turn", MatchStatus.PAUSED, MatchStatus.WAITING_FOR_DIRECTOR);
        PieceColor skipped = position.sideToMove();
        cancelTurn();
        counter.reset(skipped);
        notifyAgentActivity(skipped);
        log(LogType.DIRECTOR, skipped, "Director skipped " + skipped.displayName() + "'s turn");
        replacePosition(position.passTurn());
        continueAfterDirector();
    }

    @Override
    public synchronized void overridePrompt(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Prompt override must not be empty");
        }
        promptOverride = text;
        log(LogType.DIRECTOR, null, "Prompt override set for the next turn");
    }

    @Override
    public synchronized void setPosition(Position newPosition) {
        Objects.requireNonNull(newPosition, "position");
        log(LogType.DIRECTOR, null, "Director set position " + newPosition.toFen());
        replacePosition(newPosition);
        if (status == MatchStatus.RUNNING) {
            cancelTurn();
            scheduleNextTurn(settings.getTurnDelayMs());
        }
    }

    @Override
    public synchronized void declareResult(Outcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        if (status == MatchStatus.IDLE || status == MatchStatus.GAME_OVER) {
            throw new IllegalStateException("Cannot declare a result while " + status.displayName().toLowerCase());
        }
        cancelTurn();
        finish(new MatchResult(outcome, TerminationReason.DIRECTOR_DECISION));
    }

    // Read access

    public synchronized MatchSnapshot snapshot() {
        return new MatchSnapshot(position, status, result, errorMessage,
                counter.count(PieceColor.WHITE), counter.count(PieceColor.BLACK),
                counter.getCeiling(), usage.get(PieceColor.WHITE), usage.get(PieceColor.BLACK), matchLog.moves());
    }

    public synchronized Position getPosition() {
        return position;
    }

    public synchronized MatchStatus getStatus() {
        return status;
    }

    public synchronized MatchResult getResult() {
        return result;
    }

    public synchronized int getHallucinationCount(PieceColor side) {
        return counter.count(side);
    }

    public synchronized AgentUsage getUsage(PieceColor side) {
        return usage.get(side);
    }

    /** Every position of the match so far, the current one last. */
    public synchronized List<Position> positionHistory() {
        return List.copyOf(positions);
    }

    public MatchLog getMatchLog() {
        return matchLog;
    }

    public MoveAgent agentFor(PieceColor side) {
        return agents.get(side);
    }

    @Override
    public void close() {
        synchronized (this) {
            cancelTurn();
        }
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    // Turn loop

    private void scheduleNextTurn(long delayMs) {
        TurnToken token = new TurnToken(++turnSequence);
        currentToken = token;
        try {
            ScheduledFuture<?> delay = executor.schedule(() -> executeTurn(token), delayMs, TimeUnit.MILLISECONDS);
            token.attachDelay(delay);
        } catch (RejectedExecutionException e) {
            logger.warn("Turn scheduler is shut down; no further turns will run");
        }
    }

    private synchronized void executeTurn(TurnToken token) {
        if (token != currentToken || token.isCancelled() || status != MatchStatus.RUNNING || inFlight) {
            logger.debug("Skipping {}: no longer current", token);
            return;
        }

        TerminalState terminal = ruleEngine.terminalState(position, priorPositions());
        if (terminal.over()) {
            finish(terminal.result());
            return;
        }

        PieceColor side = position.sideToMove();
        String prompt;
        if (promptOverride != null) {
            prompt = promptOverride;
            promptOverride = null;
            log(LogType.DIRECTOR, side, "Using director prompt for " + side.displayName());
        } else {
            prompt = promptBuilder.buildPrompt(position, side, matchLog);
        }

        log(LogType.TURN, side, side.displayName() + " to move (move " + position.fullMoveNumber() + ")");
        dispatchRequest(token, side, prompt);
    }

    private void dispatchRequest(TurnToken token, PieceColor side, String prompt) {
        MoveAgent agent = agents.get(side);
        logger.debug("Requesting move from {} for {}:\n{}", agent.name(), side, prompt);
        inFlight = true;
        usage.requestStarted(side);
        long startedNanos = System.nanoTime();

        CompletableFuture<String> request;
        try {
            request = agent.requestMove(prompt).orTimeout(settings.getRequestTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            inFlight = false;
            usage.requestEnded(side, 0, true);
            fail(side, e);
            notifyAgentActivity(side);
            return;
        }
        token.attachRequest(request);
        request.whenCompleteAsync((content, error) -> handleResponse(token, side, startedNanos, content, error), executor);
    }

    private synchronized void handleResponse(TurnToken token, PieceColor side, long startedNanos,
                                             String content, Throwable error) {
        if (token != currentToken || token.isCancelled()) {
            logger.debug("Discarding response for {} from cancelled {}", side, token);
            return;
        }
        inFlight = false;
        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);

        if (error != null) {
            Throwable cause = unwrap(error);
            if (cause instanceof CancellationException) {
                logger.debug("Request for {} was cancelled", side);
                return;
            }
            usage.requestEnded(side, latencyMs, true);
            fail(side, cause);
            notifyAgentActivity(side);
            return;
        }
        usage.requestEnded(side, latencyMs, false);
        logger.debug("{} answered in {}ms", agents.get(side).name(), latencyMs);
        handleReply(token, side, content);
        notifyAgentActivity(side);
    }

    private void handleReply(TurnToken token, PieceColor side, String content) {
        if (status != MatchStatus.RUNNING) {
            return;
        }

        logger.debug("Response from {}: {}", agents.get(side).name(), content);
        AgentReply reply = replyParser.parse(content);
        if (reply.thought() != null) {
            log(LogType.THOUGHT, side, reply.thought());
        }
        if (!reply.hasMove()) {
            handleHallucination(token, side, null, "No MOVE field found in response");
            return;
        }

        MoveValidation validation = ruleEngine.validateMove(position, reply.move());
        if (!validation.legal()) {
            handleHallucination(token, side, reply.move(), validation.reason());
            return;
        }

        counter.reset(side);
        commitMove(validation.move(), side, reply.thought(), reply.trash(), MoveRecord.Source.AGENT);
        if (reply.trash() != null) {
            log(LogType.TRASH, side, reply.trash());
        }
        if (status == MatchStatus.RUNNING) {
            scheduleNextTurn(settings.getTurnDelayMs());
        }
    }

    private void handleHallucination(TurnToken token, PieceColor side, String rejectedMove, String reason) {
        int count = counter.increment(side);
        String attempted = rejectedMove == null ? "a reply without a move" : "\"" + rejectedMove + "\"";
        logger.warn("{} ({}) proposed {}: {} [{}/{}]", agents.get(side).name(), side, attempted, reason,
                count, counter.getCeiling());
        log(LogType.HALLUCINATION, side, side.displayName() + " proposed " + attempted + ": " + reason);

        if (token.isCorrectionSent() || counter.reachedCeiling(side)) {
            String why = token.isCorrectionSent()
                    ? " also answered the correction with an invalid move"
                    : " reached " + count + " consecutive invalid moves";
            log(LogType.SYSTEM, side, side.displayName() + why + "; waiting for the director");
            currentToken = null;
            setStatus(MatchStatus.WAITING_FOR_DIRECTOR);
            return;
        }

        token.markCorrectionSent();
        String correction = promptBuilder.buildCorrectionPrompt(position, side, rejectedMove, reason);
        dispatchRequest(token, side, correction);
    }

    private void commitMove(Move move, PieceColor side, String thought, String trash, MoveRecord.Source source) {
        String notation = ruleEngine.toSan(position, move);
        MoveRecord record = new MoveRecord(position.fullMoveNumber(), side, notation, move, thought, trash, source);
        Position next = ruleEngine.applyMove(position, move);

        matchLog.recordMove(record);
        log(LogType.MOVE, side, notation);
        replacePosition(next);
        for (MatchListener listener : listeners) {
            try {
                listener.onMoveApplied(record);
            } catch (RuntimeException e) {
                logger.warn("Listener failed on move", e);
            }
        }

        TerminalState terminal = ruleEngine.terminalState(position, priorPositions());
        if (terminal.over()) {
            finish(terminal.result());
        }
    }

    private void continueAfterDirector() {
        if (status == MatchStatus.GAME_OVER) {
            return;
        }
        if (status == MatchStatus.WAITING_FOR_DIRECTOR) {
            setStatus(MatchStatus.RUNNING);
        }
        if (status == MatchStatus.RUNNING) {
            scheduleNextTurn(settings.getTurnDelayMs());
        }
    }

    private void finish(MatchResult matchResult) {
        cancelTurn();
        result = matchResult;
        logger.info("Game over: {}", matchResult);
        log(LogType.SYSTEM, null, "Game over: " + matchResult);
        setStatus(MatchStatus.GAME_OVER);
        for (MatchListener listener : listeners) {
            try {
                listener.onGameOver(matchResult);
            } catch (RuntimeException e) {
                logger.warn("Listener failed on game over", e);
            }
        }
    }

    private void fail(PieceColor side, Throwable cause) {
        String agentName = agents.get(side).name();
        String message = cause instanceof TimeoutException
                ? agentName + " did not answer within " + settings.getRequestTimeoutMs() + "ms"
                : agentName + " failed: " + cause.getMessage();
        logger.error("Agent fault for {}: {}", side, message, cause);
        currentToken = null;
        errorMessage = message;
        log(LogType.ERROR, side, message);
        setStatus(MatchStatus.ERROR);
    }

    private void cancelTurn() {
        if (currentToken != null) {
            currentToken.cancel();
            currentToken = null;
        }
        inFlight = false;
    }

    private void replacePosition(Position next) {
        position = next;
        positions.add(next);
        notifyPositionChanged();
    }

    private List<Position> priorPositions() {
        return positions.subList(0, positions.size() - 1);
    }

    private void requireStatus(String action, MatchStatus... allowed) {
        for (MatchStatus candidate : allowed) {
            if (status == candidate) {
                return;
            }
        }
        logger.warn("Rejected '{}' while {}", action, status);
        throw new IllegalStateException("Cannot " + action + " while " + status.displayName().toLowerCase());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private void setStatus(MatchStatus next) {
        if (status == next) {
            return;
        }
        MatchStatus previous = status;
        status = next;
        logger.info("Match status {} -> {}", previous, next);
        for (MatchListener listener : listeners) {
            try {
                listener.onStatusChanged(previous, next);
            } catch (RuntimeException e) {
                logger.warn("Listener failed on status change", e);
            }
        }
    }

    private void notifyPositionChanged() {
        for (MatchListener listener : listeners) {
            try {
                listener.onPositionChanged(position);
            } catch (RuntimeException e) {
                logger.warn("Listener failed on position change", e);
            }
        }
    }

    private void notifyAgentActivity(PieceColor side) {
        AgentActivity activity = new AgentActivity(side, agents.get(side).name(), usage.get(side),
                counter.count(side), counter.getCeiling(), matchLog.hallucinationTotal(side));
        for (MatchListener listener : listeners) {
            try {
                listener.onAgentActivity(activity);
            } catch (RuntimeException e) {
                logger.warn("Listener failed on agent activity", e);
            }
        }
    }

    private void log(LogType type, PieceColor side, String content) {
        LogEntry entry = matchLog.append(type, side, content);
        for (MatchListener listener : listeners) {
            try {
                listener.onLogEntry(entry);
            } catch (RuntimeException e) {
                logger.warn("Listener failed on log entry", e);
            }
        }
    }
}
