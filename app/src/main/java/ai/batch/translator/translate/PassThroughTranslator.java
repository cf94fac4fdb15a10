package ai.batch.translator.translate;

import java.util.ArrayList;
import java.util.List;

/**
 * Translator used for dry runs; returns every line unchanged without invoking remote APIs.
 */
public class PassThroughTranslator implements Translator {

    @Override
    public List<String> translate(List<String> sourceLines, TranslationListener listener) {
        if (sourceLines == null) {
            return List.of();
        }
        return new ArrayList<>(sourceLines);
    }
}
