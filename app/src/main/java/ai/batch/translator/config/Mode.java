package ai.batch.translator.config;

/**
 * Operation performed by the translator CLI.
 */
public enum Mode {
    TRANSLATE,
    MODELS,
    AUDIT,
    EXTRACT;

    public static Mode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return TRANSLATE;
        }
        for (Mode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw);
    }

    public boolean needsApiAccess() {
        return this == TRANSLATE || this == MODELS;
    }
}
