package ai.batch.translator.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.batch.translator.config.ConfigFileStore;
import ai.batch.translator.config.ConfigLoader;
import ai.batch.translator.config.StoredSettings;
import ai.batch.translator.progress.ProgressEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    private final List<ProgressEvent> events = new CopyOnWriteArrayList<>();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void translatesFileInMockMode() throws IOException {
        Path input = tempDir.resolve("input.txt");
        Files.writeString(input, "0:::meta\n1:::Hello\n2:::World\n", StandardCharsets.UTF_8);

        int exitCode = application(Map.of()).run(new String[] {
                "--file", input.toString(),
                "--work-dir", tempDir.toString(),
                "--translation-mode", "mock",
                "--batch-size", "1",
                "--threads", "2",
                "--delay", "0"
        });

        assertThat(exitCode).isZero();
        assertThat(Files.readString(tempDir.resolve("tran.txt"), StandardCharsets.UTF_8))
                .isEqualTo("0:::meta\n1:::[MOCK] Hello\n2:::[MOCK] World\n");
        assertThat(events).extracting(ProgressEvent::message).contains("Started. 2 Batches.", "Finished.");
    }

    @Test
    void savesResolvedSettingsWhenRequested() throws IOException {
        Path input = tempDir.resolve("input.txt");
        Files.writeString(input, "1:::Hello\n", StandardCharsets.UTF_8);

        int exitCode = application(Map.of()).run(new String[] {
                "--file", input.toString(),
                "--work-dir", tempDir.toString(),
                "--translation-mode", "dry-run",
                "--model", "custom-model",
                "--delay", "0",
                "--save-config"
        });

        assertThat(exitCode).isZero();
        StoredSettings stored = new ConfigFileStore().load(tempDir.resolve("config.json")).orElseThrow();
        assertThat(stored.model()).isEqualTo("custom-model");
        assertThat(stored.lastFile()).isEqualTo(input.toAbsolutePath().toString());
    }

    @Test
    void extractsIdRange() throws IOException {
        Path source = tempDir.resolve("source.txt");
        Path output = tempDir.resolve("range.txt");
        Files.writeString(source, "1:::a\n2:::b\n3:::c\n", StandardCharsets.UTF_8);

        int exitCode = application(Map.of()).run(new String[] {
                "--mode", "extract", "--file", source.toString(), "--output", output.toString(),
                "--from-id", "2", "--to-id", "3", "--work-dir", tempDir.toString()
        });

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output, StandardCharsets.UTF_8)).isEqualTo("2:::b\n3:::c\n");
    }

    @Test
    void auditSucceedsOnReadableFiles() throws IOException {
        Path translated = tempDir.resolve("final.txt");
        Path source = tempDir.resolve("source.txt");
        Files.writeString(translated, "1:::Xin chao\n3:::The same words here\n", StandardCharsets.UTF_8);
        Files.writeString(source, "1:::Hello\n2:::World\n3:::The same words here\n", StandardCharsets.UTF_8);

        int exitCode = application(Map.of()).run(new String[] {
                "--mode", "audit", "--file", translated.toString(), "--source", source.toString(),
                "--work-dir", tempDir.toString()
        });

        assertThat(exitCode).isZero();
    }

    @Test
    void missingInputFileFailsJob() {
        int exitCode = application(Map.of()).run(new String[] {
                "--file", tempDir.resolve("missing.txt").toString(),
                "--work-dir", tempDir.toString(),
                "--translation-mode", "mock"
        });

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
        assertThat(events).isEmpty();
    }

    @Test
    void missingApiKeyInProductionModeFails() {
        int exitCode = application(Map.of()).run(new String[] {
                "--file", "input.txt", "--work-dir", tempDir.toString()
        });

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
    }

    @Test
    void invalidOptionReturnsUsageExitCode() {
        int exitCode = application(Map.of()).run(new String[] {"--threads", "many"});

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void helpReturnsZero() {
        assertThat(application(Map.of()).run(new String[] {"--help"})).isZero();
    }

    private CliApplication application(Map<String, String> environment) {
        ConfigLoader configLoader = new ConfigLoader(key -> Optional.ofNullable(environment.get(key)),
                new ConfigFileStore(objectMapper));
        return new CliApplication(configLoader, new ConfigFileStore(objectMapper), HttpClient.newHttpClient(),
                objectMapper, events::add);
    }
}
