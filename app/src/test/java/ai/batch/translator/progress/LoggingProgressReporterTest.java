package ai.batch.translator.progress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import org.junit.jupiter.api.Test;

class LoggingProgressReporterTest {

    @Test
    void factoriesSetAppendFlagAndIdentity() {
        ProgressEvent status = ProgressEvent.status(3, 0, 50, "Processing 1-50");
        ProgressEvent fragment = ProgressEvent.fragment(3, 0, 50, "1:::Xin");
        ProgressEvent aggregate = ProgressEvent.aggregate(1, 4, "Progress: 1/4 Batches");

        assertThat(status.append()).isFalse();
        assertThat(fragment.append()).isTrue();
        assertThat(aggregate.isAggregate()).isTrue();
        assertThat(status.isAggregate()).isFalse();
    }

    @Test
    void rejectsNegativeWorkerId() {
        assertThat(catchThrowable(() -> ProgressEvent.status(-1, 0, 0, "x")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void logsEveryKindOfEventWithoutFailing() {
        LoggingProgressReporter reporter = new LoggingProgressReporter();

        reporter.report(ProgressEvent.aggregate(0, 2, "Started. 2 Batches."));
        reporter.report(ProgressEvent.status(1, 0, 10, "Processing 1-10"));
        reporter.report(ProgressEvent.fragment(1, 0, 10, "1:::Bon"));
        reporter.report(ProgressEvent.fragment(1, 0, 10, "Error: API Status: 500. Retrying..."));
    }
}
