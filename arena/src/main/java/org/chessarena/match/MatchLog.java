package org.chessarena.match;

import org.chessarena.model.PieceColor;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Append-only feed of log entries and applied moves for one match. Cleared
 * only by a match reset.
 */
public class MatchLog {
    private final Clock clock;
    private final List<LogEntry> entries = new ArrayList<>();
    private final List<MoveRecord> moves = new ArrayList<>();
    private final Map<PieceColor, Integer> hallucinationTotals = new EnumMap<>(PieceColor.class);

    public MatchLog() {
        this(Clock.systemUTC());
    }

    public MatchLog(Clock clock) {
        this.clock = clock;
    }

    public synchronized LogEntry append(LogType type, PieceColor side, String content) {
        LogEntry entry = new LogEntry(type, side, content, clock.instant());
        entries.add(entry);
        if (type == LogType.HALLUCINATION && side != null) {
            hallucinationTotals.merge(side, 1, Integer::sum);
        }
        return entry;
    }

    public synchronized void recordMove(MoveRecord record) {
        moves.add(record);
    }

    public synchronized List<LogEntry> entries() {
        return List.copyOf(entries);
    }

    /** The last {@code count} entries, oldest first. */
    public synchronized List<LogEntry> recent(int count) {
        int from = Math.max(0, entries.size() - count);
        return List.copyOf(entries.subList(from, entries.size()));
    }

    public synchronized List<LogEntry> ofType(LogType first, LogType... rest) {
        Set<LogType> types = EnumSet.of(first, rest);
        List<LogEntry> result = new ArrayList<>();
        for (LogEntry entry : entries) {
            if (types.contains(entry.type())) {
                result.add(entry);
            }
        }
        return result;
    }

    public synchronized List<MoveRecord> moves() {
        return List.copyOf(moves);
    }

    /** Hallucinations over the whole match, unlike the consecutive counter. */
    public synchronized int hallucinationTotal(PieceColor side) {
        return hallucinationTotals.getOrDefault(side, 0);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
        moves.clear();
        hallucinationTotals.clear();
    }
}
