package ai.gamedata.translator.pipeline;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of processing one data file.
 */
public record FileOutcome(String relativePath, int uniqueStrings, int untranslated, int missingKeys,
                          boolean written, Optional<String> error) {

    public FileOutcome {
        Objects.requireNonNull(relativePath, "relativePath");
        error = error == null ? Optional.empty() : error;
    }

    public static FileOutcome failed(String relativePath, String message) {
        return new FileOutcome(relativePath, 0, 0, 0, false, Optional.of(message));
    }

    public boolean isFailure() {
        return error.isPresent();
    }
}
