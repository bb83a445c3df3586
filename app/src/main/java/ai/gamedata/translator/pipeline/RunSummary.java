package ai.gamedata.translator.pipeline;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregate of all file outcomes of a run.
 */
public record RunSummary(List<FileOutcome> outcomes) {

    public RunSummary {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public int processedFiles() {
        return (int) outcomes.stream().filter(outcome -> !outcome.isFailure()).count();
    }

    public int uniqueStrings() {
        return outcomes.stream().mapToInt(FileOutcome::uniqueStrings).sum();
    }

    public int untranslatedStrings() {
        return outcomes.stream().mapToInt(FileOutcome::untranslated).sum();
    }

    public int missingKeys() {
        return outcomes.stream().mapToInt(FileOutcome::missingKeys).sum();
    }

    public int errors() {
        return outcomes.size() - processedFiles();
    }

    public List<String> failedFiles() {
        return outcomes.stream()
                .filter(FileOutcome::isFailure)
                .map(FileOutcome::relativePath)
                .collect(Collectors.toUnmodifiableList());
    }

    public boolean hasErrors() {
        return errors() > 0;
    }
}
