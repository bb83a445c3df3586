package ai.gamedata.translator.substitute;

import java.util.List;
import java.util.Objects;

/**
 * Rewritten file text plus counters for the caller's report.
 */
public record SubstitutionResult(String text, int replacedSpans, List<String> missingKeys) {

    public SubstitutionResult {
        Objects.requireNonNull(text, "text");
        missingKeys = missingKeys == null ? List.of() : List.copyOf(missingKeys);
    }

    public boolean hasMissingKeys() {
        return !missingKeys.isEmpty();
    }
}
