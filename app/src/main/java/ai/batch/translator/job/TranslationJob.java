package ai.batch.translator.job;

import ai.batch.translator.config.TranslatorConfig;
import ai.batch.translator.progress.ProgressEvent;
import ai.batch.translator.progress.ProgressReporter;
import ai.batch.translator.translate.Translator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * One run over a partitioned file.
 *
 * <p>Batches are dispatched in source order to a pool of {@code threads} workers; a permit per worker keeps at most
 * {@code threads} batches in flight. The job waits for every dispatched batch before it writes the output file,
 * and writes it only if stop was never requested.
 */
class TranslationJob {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationJob.class);

    private final PartitionResult partition;
    private final TranslatorConfig config;
    private final Translator translator;
    private final RateLimiter rateLimiter;
    private final CancellationSignal signal;
    private final ProgressReporter reporter;
    private final WorkspacePaths paths;
    private final AtomicInteger completedBatches = new AtomicInteger();

    TranslationJob(PartitionResult partition,
                   TranslatorConfig config,
                   Translator translator,
                   RateLimiter rateLimiter,
                   CancellationSignal signal,
                   ProgressReporter reporter,
                   WorkspacePaths paths) {
        this.partition = Objects.requireNonNull(partition, "partition");
        this.config = Objects.requireNonNull(config, "config");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.signal = Objects.requireNonNull(signal, "signal");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.paths = Objects.requireNonNull(paths, "paths");
    }

    JobOutcome run() {
        int totalBatches = partition.batchCount();
        OutputBuffer buffer = new OutputBuffer(partition.initialLines(), paths.snapshotFile());
        WorkerActivityLog activityLog = new WorkerActivityLog(paths.workerLogFile());
        activityLog.reset();
        reporter.report(ProgressEvent.aggregate(0, totalBatches, "Started. " + totalBatches + " Batches."));
        LOGGER.info("Translating {} lines in {} batches with {} threads", partition.lineCount(), totalBatches,
                config.threads());

        ExecutorService workers = Executors.newFixedThreadPool(config.threads(),
                new NamedThreadFactory("translator-worker", false));
        ExecutorService calls = Executors.newCachedThreadPool(new NamedThreadFactory("translator-call", true));
        Semaphore permits = new Semaphore(config.threads());
        List<CompletableFuture<BatchState>> units = new ArrayList<>(totalBatches);
        Throwable failure = null;
        try {
            for (Batch batch : partition.batches()) {
                if (signal.isStopRequested()) {
                    break;
                }
                try {
                    permits.acquire();
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    signal.requestStop();
                    break;
                }
                if (signal.isStopRequested()) {
                    permits.release();
                    break;
                }
                int workerId = batch.number() + 1;
                activityLog.record(workerId, batch);
                BatchWorker worker = new BatchWorker(workerId, batch, translator, rateLimiter, config.pacingDelay(),
                        config.retryBackoff(), signal, buffer, reporter, calls);
                units.add(CompletableFuture.supplyAsync(() -> runUnit(worker, workerId, totalBatches, permits),
                        workers));
            }
            failure = awaitAll(units);
        } finally {
            workers.shutdown();
            calls.shutdownNow();
        }

        if (failure != null) {
            throw new IllegalStateException("Translation worker failed: " + failure.getMessage(), failure);
        }
        if (signal.isStopRequested()) {
            LOGGER.info("Job stopped after {}/{} batches; {} not written", completedBatches.get(), totalBatches,
                    paths.outputFile().getFileName());
            return new JobOutcome(JobStatus.CANCELLED, completedBatches.get(), totalBatches, buffer.size());
        }
        buffer.writeTo(paths.outputFile());
        reporter.report(ProgressEvent.aggregate(totalBatches, totalBatches, "Finished."));
        LOGGER.info("Wrote {} lines to {}", buffer.size(), paths.outputFile());
        return new JobOutcome(JobStatus.COMPLETED, completedBatches.get(), totalBatches, buffer.size());
    }

    private BatchState runUnit(BatchWorker worker, int workerId, int totalBatches, Semaphore permits) {
        MDC.put(BatchWorker.MDC_WORKER, Integer.toString(workerId));
        try {
            BatchState result = worker.run();
            if (result == BatchState.SUCCEEDED) {
                int done = completedBatches.incrementAndGet();
                reporter.report(ProgressEvent.aggregate(done, totalBatches,
                        "Progress: " + done + "/" + totalBatches + " Batches"));
            }
            return result;
        } catch (RuntimeException ex) {
            LOGGER.error("Worker {} failed; stopping job", workerId, ex);
            signal.requestStop();
            throw ex;
        } finally {
            MDC.remove(BatchWorker.MDC_WORKER);
            permits.release();
        }
    }

    private static Throwable awaitAll(List<CompletableFuture<BatchState>> units) {
        try {
            CompletableFuture.allOf(units.toArray(CompletableFuture[]::new)).join();
            return null;
        } catch (CompletionException ex) {
            return ex.getCause() == null ? ex : ex.getCause();
        }
    }
}
