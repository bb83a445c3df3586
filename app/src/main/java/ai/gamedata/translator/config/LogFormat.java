package ai.gamedata.translator.config;

import java.util.Locale;

/**
 * Console log encodings.
 */
public enum LogFormat {
    /** Human-readable pattern layout. */
    TEXT,
    /** One JSON object per event. */
    JSON;

    public static LogFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Log format must be provided");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "text", "plain" -> TEXT;
            case "json" -> JSON;
            default -> throw new IllegalArgumentException("Unsupported log format: " + raw);
        };
    }
}
