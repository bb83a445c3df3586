package ai.gamedata.translator.config;

import ai.gamedata.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments, environment values and defaults.
 */
public record Config(
        Path dataDir,
        Path outputDir,
        Path cacheFile,
        Optional<String> singleFile,
        boolean dryRun,
        boolean useCache,
        boolean skipTranslated,
        TranslationMode translationMode,
        LogFormat logFormat,
        int batchSize,
        int parallelism,
        TranslatorConfig translatorConfig,
        Secrets secrets,
        int llmMaxRetryAttempts,
        int llmInitialBackoffSeconds,
        int llmMaxBackoffSeconds,
        double llmRetryJitterFactor
) {

    public Config {
        Objects.requireNonNull(dataDir, "dataDir");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(cacheFile, "cacheFile");
        singleFile = singleFile == null ? Optional.empty() : singleFile.filter(value -> !value.isBlank());
        translationMode = Objects.requireNonNull(translationMode, "translationMode");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        translatorConfig = Objects.requireNonNull(translatorConfig, "translatorConfig");
        secrets = secrets == null ? Secrets.none() : secrets;
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        if (dataDir.toAbsolutePath().normalize().equals(outputDir.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("outputDir must differ from dataDir");
        }
        if (llmMaxRetryAttempts < 1) {
            throw new IllegalArgumentException("llmMaxRetryAttempts must be at least 1");
        }
        if (llmInitialBackoffSeconds < 1 || llmMaxBackoffSeconds < llmInitialBackoffSeconds) {
            throw new IllegalArgumentException("LLM backoff must satisfy 1 <= initial <= max");
        }
        if (llmRetryJitterFactor < 0.0 || llmRetryJitterFactor > 1.0) {
            throw new IllegalArgumentException("llmRetryJitterFactor must be between 0.0 and 1.0");
        }
    }

    public boolean writesCache() {
        return useCache && !dryRun && translationMode.recordsToCache();
    }
}
