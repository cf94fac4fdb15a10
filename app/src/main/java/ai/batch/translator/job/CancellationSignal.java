package ai.batch.translator.job;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stop flag plus a broadcast wake-up shared by every worker of one job. A new signal is created for each job.
 */
public class CancellationSignal {

    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final CompletableFuture<Void> stopped = new CompletableFuture<>();

    /**
     * Sets the flag and wakes every waiter. Returns {@code false} if stop had already been requested.
     */
    public boolean requestStop() {
        boolean first = stopRequested.compareAndSet(false, true);
        stopped.complete(null);
        return first;
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    /**
     * Blocks until {@code work} completes (normally or exceptionally) or stop is requested, whichever comes first.
     *
     * @return {@code true} if the work completed; {@code false} if the signal won, in which case the work is
     *         cancelled and abandoned
     */
    public boolean awaitUnlessStopped(CompletableFuture<?> work) {
        CompletableFuture.anyOf(work.handle((value, error) -> null), stopped).join();
        if (work.isDone()) {
            return true;
        }
        work.cancel(true);
        return false;
    }
}
