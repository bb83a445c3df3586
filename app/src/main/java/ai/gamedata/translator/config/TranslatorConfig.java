package ai.gamedata.translator.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Model provider settings plus the language pair sent in prompts.
 */
public record TranslatorConfig(LlmProvider provider, String modelName, Optional<String> baseUrl,
                               String sourceLanguage, String targetLanguage) {

    public static final String DEFAULT_SOURCE_LANGUAGE = "English";
    public static final String DEFAULT_TARGET_LANGUAGE = "Russian";

    public TranslatorConfig {
        provider = Objects.requireNonNull(provider, "provider");
        modelName = requireNonBlank(modelName, "modelName");
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
        sourceLanguage = requireNonBlank(sourceLanguage, "sourceLanguage");
        targetLanguage = requireNonBlank(targetLanguage, "targetLanguage");
    }

    public boolean isOllama() {
        return provider == LlmProvider.OLLAMA;
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
