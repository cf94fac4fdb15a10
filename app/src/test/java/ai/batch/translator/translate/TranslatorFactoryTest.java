package ai.batch.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;

import ai.batch.translator.config.SamplingOptions;
import ai.batch.translator.config.TranslatorConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class TranslatorFactoryTest {

    private final TranslatorFactory factory = new TranslatorFactory(HttpClient.newHttpClient(), new ObjectMapper());
    private final TranslatorConfig config = new TranslatorConfig("https://api.example.com/v1", "key", "model", "",
            SamplingOptions.none(), true, 1, 10, 0, Duration.ZERO);

    @Test
    void productionModeUsesHttpClient() {
        assertThat(factory.select(TranslationMode.PRODUCTION, config)).isInstanceOf(ChatCompletionClient.class);
    }

    @Test
    void dryRunReturnsLinesUnchanged() {
        Translator translator = factory.select(TranslationMode.DRY_RUN, config);

        assertThat(translator.translate(List.of("1:::Hello", "plain"))).containsExactly("1:::Hello", "plain");
    }

    @Test
    void mockPrefixesTextAndKeepsIds() {
        Translator translator = factory.select(TranslationMode.MOCK, config);

        assertThat(translator.translate(List.of(" 1 :::Hello ", "plain", "2:::")))
                .containsExactly("1:::[MOCK] Hello", "plain", "2:::[MOCK] ");
    }

    @Test
    void parsesModeNamesWithDashes() {
        assertThat(TranslationMode.from("dry-run")).isEqualTo(TranslationMode.DRY_RUN);
        assertThat(TranslationMode.from("Mock")).isEqualTo(TranslationMode.MOCK);
        assertThat(TranslationMode.from(null)).isEqualTo(TranslationMode.PRODUCTION);
    }
}
