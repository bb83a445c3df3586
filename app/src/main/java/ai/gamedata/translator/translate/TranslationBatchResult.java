package ai.gamedata.translator.translate;

import java.util.Map;
import java.util.Objects;

/**
 * Mapping for one string table plus where each entry came from.
 *
 * @param translations  original string to replacement, one entry per table entry
 * @param fromCache     entries answered by the cache
 * @param skipped       entries kept as-is because they already read as translated
 * @param requested     entries sent to the translator
 * @param untranslated  requested entries that came back unchanged or failed
 */
public record TranslationBatchResult(Map<String, String> translations, int fromCache, int skipped,
                                     int requested, int untranslated) {

    public TranslationBatchResult {
        translations = Map.copyOf(Objects.requireNonNull(translations, "translations"));
    }

    public static TranslationBatchResult empty() {
        return new TranslationBatchResult(Map.of(), 0, 0, 0, 0);
    }
}
