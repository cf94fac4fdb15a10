package ai.batch.translator.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes progress events to the log: status lines at INFO, retry errors at WARN, streamed fragments at DEBUG.
 */
public class LoggingProgressReporter implements ProgressReporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingProgressReporter.class);
    private static final String ERROR_PREFIX = "Error: ";

    @Override
    public void report(ProgressEvent event) {
        if (event.message().startsWith(ERROR_PREFIX)) {
            LOGGER.warn("[worker {}] {}", event.workerId(), event.message());
        } else if (event.append()) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("[worker {}] {}", event.workerId(), event.message());
            }
        } else if (event.isAggregate()) {
            LOGGER.info("{} ({}/{})", event.message(), event.current(), event.total());
        } else {
            LOGGER.info("[worker {}] {} ({}/{})", event.workerId(), event.message(), event.current(), event.total());
        }
    }
}
