package ai.gamedata.translator.config;

import ai.gamedata.translator.cli.CliArguments;
import ai.gamedata.translator.translate.BatchTranslationService;
import ai.gamedata.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} by combining CLI arguments with environment variables and defaults.
 * A CLI value always wins over the environment.
 */
public class ConfigLoader {

    static final String ENV_DATA_DIR = "DATA_DIR";
    static final String ENV_OUTPUT_DIR = "OUTPUT_DIR";
    static final String ENV_CACHE_FILE = "CACHE_FILE";
    static final String ENV_DRY_RUN = "DRY_RUN";
    static final String ENV_TRANSLATION_MODE = "TRANSLATION_MODE";
    static final String ENV_BATCH_SIZE = "TRANSLATION_BATCH_SIZE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_SOURCE_LANGUAGE = "SOURCE_LANGUAGE";
    static final String ENV_TARGET_LANGUAGE = "TARGET_LANGUAGE";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_LLM_MAX_RETRY_ATTEMPTS = "LLM_MAX_RETRY_ATTEMPTS";
    static final String ENV_LLM_INITIAL_BACKOFF_SECONDS = "LLM_INITIAL_BACKOFF_SECONDS";
    static final String ENV_LLM_MAX_BACKOFF_SECONDS = "LLM_MAX_BACKOFF_SECONDS";
    static final String ENV_LLM_RETRY_JITTER_FACTOR = "LLM_RETRY_JITTER_FACTOR";

    private static final String DEFAULT_DATA_DIR = "data";
    private static final String DEFAULT_OUTPUT_DIR = "translated/data";
    private static final String DEFAULT_CACHE_FILE = "translation_cache.json";
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final int DEFAULT_LLM_MAX_RETRY_ATTEMPTS = 6;
    private static final int DEFAULT_LLM_INITIAL_BACKOFF_SECONDS = 2;
    private static final int DEFAULT_LLM_MAX_BACKOFF_SECONDS = 60;
    private static final double DEFAULT_LLM_RETRY_JITTER_FACTOR = 0.3;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        boolean dryRun = resolveDryRun(arguments);
        TranslationMode translationMode = resolveTranslationMode(arguments, dryRun);
        LogFormat logFormat = resolveLogFormat(arguments);

        Path dataDir = resolvePath(arguments.dataDir(), ENV_DATA_DIR, DEFAULT_DATA_DIR);
        Path outputDir = resolvePath(arguments.outputDir(), ENV_OUTPUT_DIR, DEFAULT_OUTPUT_DIR);
        Path cacheFile = resolvePath(arguments.cacheFile(), ENV_CACHE_FILE, DEFAULT_CACHE_FILE);
        Optional<String> singleFile = Optional.ofNullable(arguments.file()).filter(ConfigLoader::isNotBlank);

        int batchSize = Optional.ofNullable(arguments.batchSize())
                .or(() -> environmentReader.get(ENV_BATCH_SIZE)
                        .filter(ConfigLoader::isNotBlank)
                        .map(String::trim)
                        .map(raw -> parsePositiveInteger(raw, ENV_BATCH_SIZE)))
                .orElse(BatchTranslationService.DEFAULT_BATCH_SIZE);
        int parallelism = Optional.ofNullable(arguments.parallelism()).orElse(1);

        LlmProvider provider = environmentReader.get(ENV_LLM_PROVIDER)
                .filter(ConfigLoader::isNotBlank)
                .map(LlmProvider::from)
                .orElse(LlmProvider.OLLAMA);
        String modelName = environmentReader.get(ENV_LLM_MODEL)
                .filter(ConfigLoader::isNotBlank)
                .orElse(provider.defaultModel());
        Optional<String> baseUrl = Optional.empty();
        if (provider == LlmProvider.OLLAMA) {
            baseUrl = Optional.of(environmentReader.get(ENV_OLLAMA_BASE_URL)
                    .filter(ConfigLoader::isNotBlank)
                    .orElse(DEFAULT_OLLAMA_BASE_URL));
        }
        String sourceLanguage = environmentReader.get(ENV_SOURCE_LANGUAGE)
                .filter(ConfigLoader::isNotBlank)
                .orElse(TranslatorConfig.DEFAULT_SOURCE_LANGUAGE);
        String targetLanguage = environmentReader.get(ENV_TARGET_LANGUAGE)
                .filter(ConfigLoader::isNotBlank)
                .orElse(TranslatorConfig.DEFAULT_TARGET_LANGUAGE);

        Optional<String> geminiApiKey = environmentReader.get(ENV_GEMINI_API_KEY).filter(ConfigLoader::isNotBlank);
        if (translationMode == TranslationMode.PRODUCTION && provider == LlmProvider.GEMINI && geminiApiKey.isEmpty()) {
            throw new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini");
        }

        int llmMaxRetryAttempts = readInteger(ENV_LLM_MAX_RETRY_ATTEMPTS, DEFAULT_LLM_MAX_RETRY_ATTEMPTS);
        int llmInitialBackoffSeconds = readInteger(ENV_LLM_INITIAL_BACKOFF_SECONDS, DEFAULT_LLM_INITIAL_BACKOFF_SECONDS);
        int llmMaxBackoffSeconds = readInteger(ENV_LLM_MAX_BACKOFF_SECONDS, DEFAULT_LLM_MAX_BACKOFF_SECONDS);
        double llmRetryJitterFactor = environmentReader.get(ENV_LLM_RETRY_JITTER_FACTOR)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parseDouble)
                .orElse(DEFAULT_LLM_RETRY_JITTER_FACTOR);

        TranslatorConfig translatorConfig = new TranslatorConfig(provider, modelName, baseUrl, sourceLanguage, targetLanguage);
        return new Config(dataDir, outputDir, cacheFile, singleFile, dryRun, !arguments.noCache(),
                arguments.skipTranslated(), translationMode, logFormat, batchSize, parallelism,
                translatorConfig, new Secrets(geminiApiKey),
                llmMaxRetryAttempts, llmInitialBackoffSeconds, llmMaxBackoffSeconds, llmRetryJitterFactor);
    }

    private boolean resolveDryRun(CliArguments arguments) {
        if (arguments.dryRun()) {
            return true;
        }
        return environmentReader.get(ENV_DRY_RUN)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private TranslationMode resolveTranslationMode(CliArguments arguments, boolean dryRun) {
        TranslationMode cliMode = arguments.translationMode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_TRANSLATION_MODE)
                .filter(ConfigLoader::isNotBlank)
                .map(TranslationMode::from)
                .orElse(dryRun ? TranslationMode.DRY_RUN : TranslationMode.PRODUCTION);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private Path resolvePath(Path cliValue, String envKey, String defaultValue) {
        if (cliValue != null) {
            return cliValue;
        }
        return Path.of(environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .orElse(defaultValue));
    }

    private int readInteger(String envKey, int defaultValue) {
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parsePositiveInteger(raw, envKey))
                .orElse(defaultValue);
    }

    private static int parsePositiveInteger(String raw, String name) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be at least 1");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be an integer", ex);
        }
    }

    private static double parseDouble(String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid double value: " + raw, ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
