package dev.providers.backend;

import java.util.concurrent.CancellationException;

/**
 * Sleeps that turn thread interruption into cancellation of the current run.
 */
final class Pauses {

    private Pauses() {}

    static void sleep(long millis, String reason) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            throw cancelled(reason, e);
        }
    }

    /** Restore the interrupt flag and build the exception that aborts the run. */
    static CancellationException cancelled(String reason, InterruptedException cause) {
        Thread.currentThread().interrupt();
        var cancelled = new CancellationException("Cancelled while " + reason);
        cancelled.initCause(cause);
        return cancelled;
    }
}
