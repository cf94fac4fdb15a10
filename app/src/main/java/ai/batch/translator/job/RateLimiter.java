package ai.batch.translator.job;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Shared pacing gate: successive reservations are spaced at least {@code delay} apart, in arrival order.
 */
public class RateLimiter {

    private final LongSupplier nanoClock;
    private final ReentrantLock lock = new ReentrantLock();
    private long lastDispatchNanos;
    private boolean hasDispatched;

    public RateLimiter() {
        this(System::nanoTime);
    }

    RateLimiter(LongSupplier nanoClock) {
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    /**
     * Claims the next dispatch slot and returns how long the caller has to wait for it. A non-positive delay never
     * waits and leaves the schedule untouched.
     */
    public Duration reserve(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return Duration.ZERO;
        }
        lock.lock();
        try {
            long now = nanoClock.getAsLong();
            long target = hasDispatched ? Math.max(now, lastDispatchNanos + delay.toNanos()) : now;
            lastDispatchNanos = target;
            hasDispatched = true;
            return Duration.ofNanos(target - now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reserves a slot and returns a future completing when it is reached.
     */
    public CompletableFuture<Void> acquire(Duration delay) {
        Duration wait = reserve(delay);
        if (wait.isZero()) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> { },
                CompletableFuture.delayedExecutor(wait.toNanos(), TimeUnit.NANOSECONDS));
    }
}
