package org.chessarena.match;

/**
 * Request statistics for one side's agent. Latency covers completed and
 * failed requests; cancelled requests count as issued only.
 */
public record AgentUsage(int requests, int errors, long totalLatencyMs, int completed) {

    public static final AgentUsage NONE = new AgentUsage(0, 0, 0, 0);

    public long averageLatencyMs() {
        return completed == 0 ? 0 : totalLatencyMs / completed;
    }
}
