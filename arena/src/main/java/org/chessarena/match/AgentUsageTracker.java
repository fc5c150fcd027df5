package org.chessarena.match;

import org.chessarena.model.PieceColor;

import java.util.EnumMap;
import java.util.Map;

class AgentUsageTracker {
    private final Map<PieceColor, AgentUsage> usage = new EnumMap<>(PieceColor.class);

    void requestStarted(PieceColor side) {
        AgentUsage current = get(side);
        usage.put(side, new AgentUsage(current.requests() + 1, current.errors(),
                current.totalLatencyMs(), current.completed()));
    }

    void requestEnded(PieceColor side, long latencyMs, boolean failed) {
        AgentUsage current = get(side);
        usage.put(side, new AgentUsage(current.requests(), current.errors() + (failed ? 1 : 0),
                current.totalLatencyMs() + latencyMs, current.completed() + 1));
    }

    AgentUsage get(PieceColor side) {
        return usage.getOrDefault(side, AgentUsage.NONE);
    }

    void clear() {
        usage.clear();
    }
}
