package ai.batch.translator.translate;

import ai.batch.translator.line.LineFormat;
import java.util.ArrayList;
import java.util.List;

/**
 * Offline translator that tags the text of every identified line with {@code [MOCK]}.
 */
public class MockTranslator implements Translator {

    @Override
    public List<String> translate(List<String> sourceLines, TranslationListener listener) {
        List<String> result = new ArrayList<>(sourceLines.size());
        for (String line : sourceLines) {
            result.add(LineFormat.parse(line)
                    .map(parsed -> LineFormat.format(parsed.id(), "[MOCK] " + parsed.text().trim()))
                    .orElse(line));
        }
        return result;
    }
}
