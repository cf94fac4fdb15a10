package ai.batch.translator.audit;

import ai.batch.translator.line.LineFormat;
import ai.batch.translator.line.ParsedLine;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Checks a translated file against its source for missing IDs and for lines that were left untranslated.
 *
 * <p>A line is suspicious when, after reducing both sides to lowercase ASCII words, the first three words match
 * (both sides having at least three) or both word lists are non-empty and identical.
 */
public class TranslationAuditor {

    private static final Pattern NON_LETTERS = Pattern.compile("[^a-zA-Z\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int COMPARED_WORDS = 3;

    public AuditReport audit(Path translatedFile, Path sourceFile) throws IOException {
        Objects.requireNonNull(translatedFile, "translatedFile");
        Objects.requireNonNull(sourceFile, "sourceFile");
        Map<Long, String> translated = new HashMap<>();
        List<Long> ids = new ArrayList<>();
        forEachNumberedLine(translatedFile, (id, text) -> {
            translated.put(id, text);
            ids.add(id);
        });
        if (ids.isEmpty()) {
            return new AuditReport(null, null, List.of(), List.of());
        }
        ids.sort(null);

        List<AuditReport.IdGap> gaps = new ArrayList<>();
        for (int i = 0; i + 1 < ids.size(); i++) {
            long current = ids.get(i);
            long next = ids.get(i + 1);
            if (next - current > 1) {
                gaps.add(new AuditReport.IdGap(current + 1, next - 1));
            }
        }

        List<AuditReport.SuspiciousLine> suspicious = new ArrayList<>();
        forEachNumberedLine(sourceFile, (id, sourceText) -> {
            String translatedText = translated.get(id);
            if (translatedText != null && looksUntranslated(sourceText, translatedText)) {
                suspicious.add(new AuditReport.SuspiciousLine(id, sourceText, translatedText));
            }
        });
        return new AuditReport(ids.get(0), ids.get(ids.size() - 1), gaps, suspicious);
    }

    static boolean looksUntranslated(String sourceText, String translatedText) {
        if (sourceText.isEmpty() && translatedText.isEmpty()) {
            return false;
        }
        List<String> sourceWords = words(sourceText);
        List<String> translatedWords = words(translatedText);
        if (sourceWords.isEmpty() || translatedWords.isEmpty()) {
            return false;
        }
        if (sourceWords.size() >= COMPARED_WORDS && translatedWords.size() >= COMPARED_WORDS) {
            return sourceWords.subList(0, COMPARED_WORDS).equals(translatedWords.subList(0, COMPARED_WORDS));
        }
        return sourceWords.equals(translatedWords);
    }

    static List<String> words(String text) {
        String letters = NON_LETTERS.matcher(text).replaceAll("").toLowerCase(Locale.ROOT).trim();
        if (letters.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(WHITESPACE.split(letters));
    }

    private static void forEachNumberedLine(Path file, NumberedLineConsumer consumer) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                ParsedLine parsed = LineFormat.parse(line).orElse(null);
                if (parsed == null) {
                    continue;
                }
                OptionalLong id = LineFormat.numericId(parsed.id());
                if (id.isPresent()) {
                    consumer.accept(id.getAsLong(), parsed.text().trim());
                }
            }
        }
    }

    @FunctionalInterface
    private interface NumberedLineConsumer {
        void accept(long id, String text);
    }
}
