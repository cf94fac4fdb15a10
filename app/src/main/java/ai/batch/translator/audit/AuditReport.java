package ai.batch.translator.audit;

import java.util.List;
import java.util.Objects;

/**
 * Findings of a {@link TranslationAuditor} run.
 *
 * @param firstId   smallest numeric ID of the translated file, or {@code null} if it has none
 * @param lastId    largest numeric ID of the translated file, or {@code null} if it has none
 * @param gaps      ranges of IDs missing between {@code firstId} and {@code lastId}
 * @param suspicious lines whose translation looks like the untranslated source
 */
public record AuditReport(Long firstId, Long lastId, List<IdGap> gaps, List<SuspiciousLine> suspicious) {

    public AuditReport {
        gaps = List.copyOf(Objects.requireNonNull(gaps, "gaps"));
        suspicious = List.copyOf(Objects.requireNonNull(suspicious, "suspicious"));
    }

    public long missingIdCount() {
        return gaps.stream().mapToLong(IdGap::size).sum();
    }

    public boolean isClean() {
        return gaps.isEmpty() && suspicious.isEmpty();
    }

    /**
     * Inclusive run of missing IDs.
     */
    public record IdGap(long fromId, long toId) {

        public long size() {
            return toId - fromId + 1;
        }
    }

    public record SuspiciousLine(long id, String sourceText, String translatedText) {
    }
}
