package ai.gamedata.translator.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Original-to-translated string map shared by every file of a run. Entries are only added or
 * overwritten, never removed; all access is serialized so files may be processed in parallel.
 */
public class TranslationCache {

    private final Map<String, String> entries = new LinkedHashMap<>();

    public TranslationCache() {
    }

    public TranslationCache(Map<String, String> initialEntries) {
        if (initialEntries != null) {
            initialEntries.forEach((key, value) -> {
                if (key != null && value != null) {
                    entries.put(key, value);
                }
            });
        }
    }

    public synchronized Optional<String> lookup(String original) {
        return Optional.ofNullable(entries.get(original));
    }

    public synchronized void record(String original, String translated) {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(translated, "translated");
        entries.put(original, translated);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized Map<String, String> snapshot() {
        return new LinkedHashMap<>(entries);
    }
}
