package ai.batch.translator.audit;

import ai.batch.translator.config.IdRange;
import ai.batch.translator.line.LineFormat;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies the lines whose numeric ID falls inside a range to a new file, keeping source order.
 */
public class IdRangeExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(IdRangeExtractor.class);

    /**
     * @return the number of lines written
     */
    public int extract(Path source, Path target, IdRange range) throws IOException {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(range, "range");
        int count = 0;
        try (BufferedReader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8);
             BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (inRange(line, range)) {
                    writer.write(line);
                    writer.write('\n');
                    count++;
                }
            }
        }
        LOGGER.info("Extracted {} lines with IDs {}-{} to {}", count, range.fromId(), range.toId(), target);
        return count;
    }

    private static boolean inRange(String line, IdRange range) {
        OptionalLong id = LineFormat.parse(line)
                .map(parsed -> LineFormat.numericId(parsed.id()))
                .orElse(OptionalLong.empty());
        return id.isPresent() && range.contains(id.getAsLong());
    }
}
