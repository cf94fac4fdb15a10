package ai.batch.translator.job;

import ai.batch.translator.progress.ProgressEvent;
import ai.batch.translator.progress.ProgressReporter;
import ai.batch.translator.translate.TranslationListener;
import ai.batch.translator.translate.Translator;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Drives a single batch to completion: pace, call, merge, report. Failed calls are retried after a fixed backoff
 * until one succeeds or the job is stopped.
 *
 * <p>A call that completes before the stop signal is merged even if stop was requested in the meantime.
 */
class BatchWorker {

    static final String MDC_WORKER = "worker";
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchWorker.class);

    private final int workerId;
    private final Batch batch;
    private final Translator translator;
    private final RateLimiter rateLimiter;
    private final Duration pacingDelay;
    private final Duration retryBackoff;
    private final CancellationSignal signal;
    private final OutputBuffer buffer;
    private final ProgressReporter reporter;
    private final Executor callExecutor;
    private volatile BatchState state = BatchState.PENDING;
    private int attempts;

    BatchWorker(int workerId,
                Batch batch,
                Translator translator,
                RateLimiter rateLimiter,
                Duration pacingDelay,
                Duration retryBackoff,
                CancellationSignal signal,
                OutputBuffer buffer,
                ProgressReporter reporter,
                Executor callExecutor) {
        this.workerId = workerId;
        this.batch = Objects.requireNonNull(batch, "batch");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.pacingDelay = Objects.requireNonNull(pacingDelay, "pacingDelay");
        this.retryBackoff = Objects.requireNonNull(retryBackoff, "retryBackoff");
        this.signal = Objects.requireNonNull(signal, "signal");
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.callExecutor = Objects.requireNonNull(callExecutor, "callExecutor");
    }

    BatchState run() {
        int total = batch.size();
        reporter.report(ProgressEvent.status(workerId, 0, total,
                "Processing " + batch.firstLabel() + "-" + batch.lastLabel()));
        while (true) {
            if (signal.isStopRequested()) {
                return transition(BatchState.CANCELLED);
            }
            transition(BatchState.WAITING);
            if (!signal.awaitUnlessStopped(rateLimiter.acquire(pacingDelay))) {
                return transition(BatchState.CANCELLED);
            }

            transition(BatchState.IN_FLIGHT);
            attempts++;
            CompletableFuture<List<String>> call = CompletableFuture.supplyAsync(this::callTranslator, callExecutor);
            if (!signal.awaitUnlessStopped(call)) {
                LOGGER.debug("Abandoned in-flight request for batch {}", batch.number());
                return transition(BatchState.CANCELLED);
            }

            List<String> translated;
            try {
                translated = call.join();
            } catch (CompletionException ex) {
                Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                reporter.report(ProgressEvent.fragment(workerId, 0, total,
                        "Error: " + describe(cause) + ". Retrying..."));
                LOGGER.debug("Attempt {} for batch {} failed", attempts, batch.number(), cause);
                transition(BatchState.BACKOFF);
                if (!signal.awaitUnlessStopped(backoff())) {
                    return transition(BatchState.CANCELLED);
                }
                continue;
            }

            buffer.merge(batch.indices(), translated);
            reporter.report(ProgressEvent.status(workerId, total, total, "Done."));
            return transition(BatchState.SUCCEEDED);
        }
    }

    BatchState state() {
        return state;
    }

    int attempts() {
        return attempts;
    }

    private List<String> callTranslator() {
        MDC.put(MDC_WORKER, Integer.toString(workerId));
        try {
            return translator.translate(batch.lines(), new ReportingListener(batch.size()));
        } finally {
            MDC.remove(MDC_WORKER);
        }
    }

    private CompletableFuture<Void> backoff() {
        if (retryBackoff.isZero()) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> { },
                CompletableFuture.delayedExecutor(retryBackoff.toNanos(), TimeUnit.NANOSECONDS));
    }

    private BatchState transition(BatchState next) {
        state = next;
        return next;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private final class ReportingListener implements TranslationListener {

        private final int total;

        private ReportingListener(int total) {
            this.total = total;
        }

        @Override
        public void onFragment(String fragment) {
            reporter.report(ProgressEvent.fragment(workerId, 0, total, fragment));
        }

        @Override
        public void onReceived(int characterCount) {
            reporter.report(ProgressEvent.fragment(workerId, 0, total, "Received " + characterCount + " chars"));
        }
    }
}
