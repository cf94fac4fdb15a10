package ai.batch.translator.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void formatsEventAsJson() throws Exception {
        LoggingEvent event = event("hello \"world\"\nnext line");

        String json = layout().doLayout(event);

        assertThat(json).endsWith(System.lineSeparator());
        JsonNode node = objectMapper.readTree(json);
        assertThat(node.path("message").asText()).isEqualTo("hello \"world\"\nnext line");
        assertThat(node.path("logger").asText()).isEqualTo("test.logger");
        assertThat(node.path("level").asText()).isEqualTo("INFO");
        assertThat(node.path("thread").asText()).isEqualTo("translator-worker-1");
        assertThat(node.path("timestamp").asText()).isEqualTo("1970-01-01T00:00:00Z");
        assertThat(node.has("mdc")).isFalse();
    }

    @Test
    void includesMdcEntries() throws Exception {
        LoggingEvent event = event("Processing 1-50");
        event.setMDCPropertyMap(Map.of("worker", "3"));

        JsonNode node = objectMapper.readTree(layout().doLayout(event));

        assertThat(node.path("mdc").path("worker").asText()).isEqualTo("3");
    }

    @Test
    void includesErrorSummary() throws Exception {
        LoggingEvent event = event("failed");
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("boom")));

        JsonNode node = objectMapper.readTree(layout().doLayout(event));

        assertThat(node.path("error").path("type").asText()).isEqualTo("java.lang.IllegalStateException");
        assertThat(node.path("error").path("message").asText()).isEqualTo("boom");
    }

    private static SimpleJsonLayout layout() {
        LoggerContext context = new LoggerContext();
        context.start();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        return layout;
    }

    private static LoggingEvent event(String message) {
        LoggerContext context = new LoggerContext();
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("translator-worker-1");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }
}
