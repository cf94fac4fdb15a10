package ai.batch.translator.line;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Reads and writes the {@code ID:::Text} line protocol shared by input, snapshot and output files.
 */
public final class LineFormat {

    public static final String SEPARATOR = ":::";
    private static final String HEADER_PREFIX = "0" + SEPARATOR;

    private LineFormat() {
    }

    /**
     * Splits a line at its first separator. Lines without a separator carry no ID.
     */
    public static Optional<ParsedLine> parse(String line) {
        if (line == null) {
            return Optional.empty();
        }
        int separatorIndex = line.indexOf(SEPARATOR);
        if (separatorIndex < 0) {
            return Optional.empty();
        }
        String id = line.substring(0, separatorIndex).trim();
        String text = line.substring(separatorIndex + SEPARATOR.length());
        return Optional.of(new ParsedLine(id, text));
    }

    public static String format(String id, String text) {
        return id.trim() + SEPARATOR + text;
    }

    /**
     * Returns {@code "<id>:::"} for identified lines, or the line itself when it has no ID.
     */
    public static String placeholder(String line) {
        return parse(line)
                .map(parsed -> parsed.id() + SEPARATOR)
                .orElse(line);
    }

    public static boolean isHeader(String line) {
        return line != null && line.startsWith(HEADER_PREFIX);
    }

    /**
     * Label used when logging a line range: the trimmed text before the first separator.
     */
    public static String label(String line) {
        if (line == null) {
            return "?";
        }
        int separatorIndex = line.indexOf(SEPARATOR);
        String head = separatorIndex < 0 ? line : line.substring(0, separatorIndex);
        return head.trim();
    }

    /**
     * Parses a numeric ID, accepting an optional leading minus sign.
     */
    public static OptionalLong numericId(String id) {
        if (id == null || id.isEmpty()) {
            return OptionalLong.empty();
        }
        int start = id.charAt(0) == '-' ? 1 : 0;
        if (start == id.length()) {
            return OptionalLong.empty();
        }
        for (int i = start; i < id.length(); i++) {
            if (!Character.isDigit(id.charAt(i))) {
                return OptionalLong.empty();
            }
        }
        try {
            return OptionalLong.of(Long.parseLong(id));
        } catch (NumberFormatException ex) {
            return OptionalLong.empty();
        }
    }
}
