package org.chessarena.match;

import java.util.concurrent.Future;

/**
 * Cancellation handle for one scheduled turn. The delay before the turn and
 * the agent request it issues share the token, so a single {@link #cancel()}
 * stops whichever is outstanding.
 */
final class TurnToken {
    private final long id;
    private Future<?> delay;
    private Future<?> request;
    private volatile boolean cancelled;
    private boolean correctionSent;

    TurnToken(long id) {
        this.id = id;
    }

    synchronized void attachDelay(Future<?> delay) {
        this.delay = delay;
        if (cancelled) {
            delay.cancel(false);
        }
    }

    synchronized void attachRequest(Future<?> request) {
        this.request = request;
        if (cancelled) {
            request.cancel(true);
        }
    }

    synchronized void cancel() {
        cancelled = true;
        if (delay != null) {
            delay.cancel(false);
        }
        if (request != null) {
            request.cancel(true);
        }
    }

    /** Records that this turn has used its one correction request. */
    synchronized void markCorrectionSent() {
        correctionSent = true;
    }

    synchronized boolean isCorrectionSent() {
        return correctionSent;
    }

    boolean isCancelled() {
        return cancelled;
    }

    @Override
    public String toString() {
        return "turn#" + id;
    }
}
