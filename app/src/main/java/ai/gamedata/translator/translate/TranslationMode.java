package ai.gamedata.translator.translate;

import java.util.Locale;

/**
 * Which translator backs a run.
 */
public enum TranslationMode {
    /** Calls the configured model and records results in the cache. */
    PRODUCTION,
    /** Keeps every string as-is. */
    DRY_RUN,
    /** Marks every string without calling a model. */
    MOCK;

    public static TranslationMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PRODUCTION;
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (TranslationMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported translation mode: " + raw);
    }

    public boolean recordsToCache() {
        return this == PRODUCTION;
    }
}
