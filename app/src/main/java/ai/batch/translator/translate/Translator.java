package ai.batch.translator.translate;

import java.util.List;

/**
 * Translates one batch of {@code ID:::Text} lines.
 *
 * <p>The result has exactly one entry per source line, in source order. Implementations throw
 * {@link TranslationException} on failure and must not modify the source list.
 */
public interface Translator {

    List<String> translate(List<String> sourceLines, TranslationListener listener);

    default List<String> translate(List<String> sourceLines) {
        return translate(sourceLines, TranslationListener.NONE);
    }
}
