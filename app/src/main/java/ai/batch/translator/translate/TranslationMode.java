package ai.batch.translator.translate;

/**
 * Mode controlling how batches are translated.
 */
public enum TranslationMode {
    PRODUCTION,
    DRY_RUN,
    MOCK;

    public static TranslationMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PRODUCTION;
        }
        String normalized = raw.trim().replace('-', '_');
        for (TranslationMode mode : values()) {
            if (mode.name().equalsIgnoreCase(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported translation mode: " + raw);
    }
}
