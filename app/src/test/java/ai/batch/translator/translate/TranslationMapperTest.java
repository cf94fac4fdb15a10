package ai.batch.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class TranslationMapperTest {

    private final TranslationMapper mapper = new TranslationMapper();

    @Test
    void mapsTranslationsOntoSourceIds() {
        List<String> result = mapper.map(List.of("1:::Hello", "2:::World"), "1:::Bonjour\n2:::Monde");

        assertThat(result).containsExactly("1:::Bonjour", "2:::Monde");
    }

    @Test
    void keepsSourceLineWhenIdMissingFromResponse() {
        List<String> result = mapper.map(List.of("1:::Hello", "2:::World"), "2:::Monde");

        assertThat(result).containsExactly("1:::Hello", "2:::Monde");
    }

    @Test
    void passesThroughLinesWithoutSeparator() {
        List<String> result = mapper.map(List.of("1:::Hello", "plain line"), "1:::Bonjour\nplain line:::oops");

        assertThat(result).containsExactly("1:::Bonjour", "plain line");
    }

    @Test
    void trimsIdsAndTextAndLastOccurrenceWins() {
        String content = "\n  1 :::  first  \nchatter without id\n1:::second\r\n 2:::Deux ";

        List<String> result = mapper.map(List.of(" 1 :::One", "2:::Two"), content);

        assertThat(result).containsExactly("1:::second", "2:::Deux");
    }

    @Test
    void blankContentLeavesBatchUntouched() {
        List<String> source = List.of("1:::Hello", "2:::World");

        assertThat(mapper.map(source, "")).isEqualTo(source);
        assertThat(mapper.map(source, null)).isEqualTo(source);
    }
}
