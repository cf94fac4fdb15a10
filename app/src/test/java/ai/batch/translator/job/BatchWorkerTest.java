package ai.batch.translator.job;

import static org.assertj.core.api.Assertions.assertThat;

import ai.batch.translator.progress.ProgressEvent;
import ai.batch.translator.translate.TranslationException;
import ai.batch.translator.translate.Translator;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BatchWorkerTest {

    @TempDir
    Path tempDir;

    private final ExecutorService calls = Executors.newCachedThreadPool();
    private final List<ProgressEvent> events = new CopyOnWriteArrayList<>();
    private final Batch batch = new LinePartitioner(2).partition("1:::a\n2:::b").batches().get(0);

    @AfterEach
    void shutdown() {
        calls.shutdownNow();
    }

    @Test
    void successfulCallMergesAndSucceeds() {
        OutputBuffer buffer = new OutputBuffer(List.of("1:::", "2:::"), tempDir.resolve("snap.txt"));
        BatchWorker worker = worker((lines, listener) -> List.of("1:::A", "2:::B"), new CancellationSignal(), buffer);

        assertThat(worker.run()).isEqualTo(BatchState.SUCCEEDED);
        assertThat(worker.attempts()).isEqualTo(1);
        assertThat(buffer.lines()).containsExactly("1:::A", "2:::B");
        assertThat(events).extracting(ProgressEvent::message).containsExactly("Processing 1-2", "Done.");
        assertThat(events.get(1).current()).isEqualTo(2);
        assertThat(events.get(1).total()).isEqualTo(2);
    }

    @Test
    void alreadyStoppedSignalCancelsWithoutCalling() {
        CancellationSignal signal = new CancellationSignal();
        signal.requestStop();
        AtomicInteger invocations = new AtomicInteger();
        OutputBuffer buffer = new OutputBuffer(List.of("1:::", "2:::"), tempDir.resolve("snap.txt"));
        BatchWorker worker = worker((lines, listener) -> {
            invocations.incrementAndGet();
            return lines;
        }, signal, buffer);

        assertThat(worker.run()).isEqualTo(BatchState.CANCELLED);
        assertThat(worker.state().isTerminal()).isTrue();
        assertThat(invocations.get()).isZero();
        assertThat(buffer.mergedCount()).isZero();
    }

    @Test
    void errorWithoutMessageIsReportedByType() {
        AtomicInteger attempts = new AtomicInteger();
        OutputBuffer buffer = new OutputBuffer(List.of("1:::", "2:::"), tempDir.resolve("snap.txt"));
        BatchWorker worker = worker((lines, listener) -> {
            if (attempts.incrementAndGet() == 1) {
                throw new TranslationException(null);
            }
            return lines;
        }, new CancellationSignal(), buffer);

        assertThat(worker.run()).isEqualTo(BatchState.SUCCEEDED);
        assertThat(worker.attempts()).isEqualTo(2);
        assertThat(events).extracting(ProgressEvent::message)
                .contains("Error: TranslationException. Retrying...");
    }

    private BatchWorker worker(Translator translator, CancellationSignal signal, OutputBuffer buffer) {
        return new BatchWorker(1, batch, translator, new RateLimiter(), Duration.ZERO, Duration.ofMillis(5), signal,
                buffer, events::add, calls);
    }
}
