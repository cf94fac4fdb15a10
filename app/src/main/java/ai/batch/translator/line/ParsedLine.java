package ai.batch.translator.line;

import java.util.Objects;

/**
 * A line split into its trimmed ID and the text following the separator.
 */
public record ParsedLine(String id, String text) {

    public ParsedLine {
        id = Objects.requireNonNull(id, "id");
        text = Objects.requireNonNull(text, "text");
    }
}
