package org.chessarena.match;

import org.chessarena.rules.MatchResult;

import java.util.ArrayList;
import java.util.List;

class RecordingListener implements MatchListener {
    private final List<MatchStatus> statuses = new ArrayList<>();
    private final List<MoveRecord> moves = new ArrayList<>();
    private final List<AgentActivity> activities = new ArrayList<>();
    private final List<MatchResult> results = new ArrayList<>();

    @Override
    public synchronized void onStatusChanged(MatchStatus previous, MatchStatus current) {
        statuses.add(current);
        notifyAll();
    }

    @Override
    public synchronized void onMoveApplied(MoveRecord record) {
        moves.add(record);
    }

    @Override
    public synchronized void onAgentActivity(AgentActivity activity) {
        activities.add(activity);
    }

    @Override
    public synchronized void onGameOver(MatchResult result) {
        results.add(result);
    }

    synchronized List<AgentActivity> activities() {
        return List.copyOf(activities);
    }

    synchronized List<MatchResult> results() {
        return List.copyOf(results);
    }

    synchronized List<MatchStatus> statuses() {
        return List.copyOf(statuses);
    }

    synchronized List<MoveRecord> moves() {
        return List.copyOf(moves);
    }

    synchronized void awaitStatus(MatchStatus expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!statuses.contains(expected)) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                throw new AssertionError("Status " + expected + " not reached; saw " + statuses);
            }
            wait(remaining);
        }
    }
}
