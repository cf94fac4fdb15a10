package ai.batch.translator.translate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Incremental decoder for server-sent chat-completion chunks ({@code data: {...}} lines ending with
 * {@code data: [DONE]}).
 *
 * <p>Bytes are buffered until a newline arrives, so a frame split across network reads, including one split
 * inside a multi-byte character, is decoded only once it is complete. Not thread-safe; one instance per response.
 */
public class StreamingResponseDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamingResponseDecoder.class);
    private static final String DATA_PREFIX = "data:";
    private static final String DONE_MARKER = "[DONE]";

    private final ObjectMapper objectMapper;
    private final Consumer<String> fragmentConsumer;
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private final StringBuilder content = new StringBuilder();
    private boolean done;

    public StreamingResponseDecoder(ObjectMapper objectMapper, Consumer<String> fragmentConsumer) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.fragmentConsumer = Objects.requireNonNull(fragmentConsumer, "fragmentConsumer");
    }

    public void feed(byte[] chunk, int offset, int length) {
        pending.write(chunk, offset, length);
        byte[] buffered = pending.toByteArray();
        int lastNewline = lastIndexOfNewline(buffered);
        if (lastNewline < 0) {
            return;
        }
        String complete = new String(buffered, 0, lastNewline + 1, StandardCharsets.UTF_8);
        pending.reset();
        pending.write(buffered, lastNewline + 1, buffered.length - lastNewline - 1);
        decodeLines(complete);
    }

    public void feed(byte[] chunk) {
        feed(chunk, 0, chunk.length);
    }

    /**
     * Decodes whatever is left in the buffer and returns the accumulated content.
     */
    public String finish() {
        if (pending.size() > 0) {
            String residual = pending.toString(StandardCharsets.UTF_8);
            pending.reset();
            decodeLines(residual);
        }
        return content.toString();
    }

    public boolean isDone() {
        return done;
    }

    private void decodeLines(String text) {
        for (String rawLine : text.split("\n")) {
            if (done) {
                return;
            }
            String line = rawLine.trim();
            if (!line.startsWith(DATA_PREFIX)) {
                continue;
            }
            String data = line.substring(DATA_PREFIX.length()).trim();
            if (DONE_MARKER.equals(data)) {
                done = true;
                return;
            }
            decodeFrame(data);
        }
    }

    private void decodeFrame(String data) {
        JsonNode frame;
        try {
            frame = objectMapper.readTree(data);
        } catch (JsonProcessingException ex) {
            LOGGER.debug("Skipping undecodable stream frame: {}", ex.getOriginalMessage());
            return;
        }
        JsonNode delta = frame.path("choices").path(0).path("delta").path("content");
        if (delta.isTextual()) {
            String fragment = delta.asText();
            content.append(fragment);
            fragmentConsumer.accept(fragment);
        }
    }

    private static int lastIndexOfNewline(byte[] bytes) {
        for (int i = bytes.length - 1; i >= 0; i--) {
            if (bytes[i] == '\n') {
                return i;
            }
        }
        return -1;
    }
}
