package ai.batch.translator.translate;

import ai.batch.translator.line.LineFormat;
import ai.batch.translator.line.ParsedLine;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the raw text returned by the model back onto the IDs of the source batch.
 *
 * <p>Lines the model did not return keep their original content; lines without an ID are passed through.
 */
public class TranslationMapper {

    public List<String> map(List<String> sourceLines, String fullContent) {
        Map<String, String> translatedById = index(fullContent);
        List<String> result = new ArrayList<>(sourceLines.size());
        for (String line : sourceLines) {
            Optional<ParsedLine> parsed = LineFormat.parse(line);
            if (parsed.isEmpty() || parsed.get().id().isEmpty()) {
                result.add(line);
                continue;
            }
            String id = parsed.get().id();
            String translated = translatedById.get(id);
            result.add(translated == null ? line : LineFormat.format(id, translated));
        }
        return result;
    }

    Map<String, String> index(String fullContent) {
        Map<String, String> translatedById = new HashMap<>();
        if (fullContent == null || fullContent.isBlank()) {
            return translatedById;
        }
        for (String line : fullContent.trim().split("\n")) {
            LineFormat.parse(line).ifPresent(parsed -> translatedById.put(parsed.id(), parsed.text().trim()));
        }
        return translatedById;
    }
}
