package ai.batch.translator.audit;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TranslationAuditorTest {

    @TempDir
    Path tempDir;

    private final TranslationAuditor auditor = new TranslationAuditor();

    @Test
    void reportsIdGapsAsRanges() throws IOException {
        Path translated = write("final.txt", "1:::a\n2:::b\n5:::e\n6:::f\n8:::h\nnot numbered:::x\n");
        Path source = write("source.txt", "");

        AuditReport report = auditor.audit(translated, source);

        assertThat(report.firstId()).isEqualTo(1L);
        assertThat(report.lastId()).isEqualTo(8L);
        assertThat(report.gaps()).containsExactly(new AuditReport.IdGap(3, 4), new AuditReport.IdGap(7, 7));
        assertThat(report.missingIdCount()).isEqualTo(3);
    }

    @Test
    void flagsLinesThatLookUntranslated() throws IOException {
        Path translated = write("final.txt", String.join("\n",
                "1:::The old king is dead, long live the king.",
                "2:::Vua già đã chết.",
                "3:::Yes!",
                "4:::",
                "5:::...",
                ""));
        Path source = write("source.txt", String.join("\n",
                "1:::The old king has died.",
                "2:::The old king is dead.",
                "3:::yes",
                "4:::",
                "5:::!!!",
                "6:::Only in source",
                ""));

        AuditReport report = auditor.audit(translated, source);

        assertThat(report.suspicious()).extracting(AuditReport.SuspiciousLine::id).containsExactly(1L, 3L);
        assertThat(report.suspicious().get(0).sourceText()).isEqualTo("The old king has died.");
        assertThat(report.isClean()).isFalse();
    }

    @Test
    void shortLinesMustMatchExactly() {
        assertThat(TranslationAuditor.looksUntranslated("Hello there", "hello, there!")).isTrue();
        assertThat(TranslationAuditor.looksUntranslated("Hello there", "Hello")).isFalse();
        assertThat(TranslationAuditor.looksUntranslated("", "")).isFalse();
        assertThat(TranslationAuditor.words("  Đi đâu vậy? Go 2 home ")).containsExactly("i", "u", "vy", "go", "home");
    }

    @Test
    void fileWithoutNumberedLinesYieldsEmptyReport() throws IOException {
        AuditReport report = auditor.audit(write("final.txt", "header\n"), write("source.txt", "1:::a\n"));

        assertThat(report.firstId()).isNull();
        assertThat(report.isClean()).isTrue();
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
