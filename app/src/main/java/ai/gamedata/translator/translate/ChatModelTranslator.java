package ai.gamedata.translator.translate;

import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translator backed by a LangChain4j {@link ChatModel}. A batch is sent as one numbered list;
 * when the reply cannot be matched back to the inputs each string is requested on its own.
 */
public class ChatModelTranslator implements Translator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelTranslator.class);
    private static final Pattern NUMBERED_LINE = Pattern.compile("^\\s*(\\d+)\\s*[.):]\\s?(.*)$");

    private final ChatModel model;
    private final String providerName;
    private final String modelName;
    private final String sourceLanguage;
    private final String targetLanguage;

    public ChatModelTranslator(ChatModel model, String providerName, String modelName,
                               String sourceLanguage, String targetLanguage) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
        this.sourceLanguage = requireNonBlank(sourceLanguage, "sourceLanguage");
        this.targetLanguage = requireNonBlank(targetLanguage, "targetLanguage");
    }

    @Override
    public List<String> translate(List<String> sourceStrings) {
        if (sourceStrings == null || sourceStrings.isEmpty()) {
            return List.of();
        }
        if (sourceStrings.size() == 1) {
            return List.of(translateSingle(sourceStrings.get(0)));
        }
        Optional<List<String>> batch = translateBatch(sourceStrings);
        if (batch.isPresent()) {
            return batch.get();
        }
        LOGGER.warn("{} reply did not match {} numbered inputs; requesting strings one by one",
                providerName, sourceStrings.size());
        List<String> result = new ArrayList<>(sourceStrings.size());
        for (String source : sourceStrings) {
            result.add(translateSingle(source));
        }
        return List.copyOf(result);
    }

    private Optional<List<String>> translateBatch(List<String> sourceStrings) {
        String response;
        try {
            response = model.chat(buildBatchPrompt(sourceStrings));
        } catch (RuntimeException ex) {
            rethrowIfFatal(ex);
            LOGGER.warn("{} batch request failed: {}", providerName, ex.getMessage());
            return Optional.empty();
        }
        if (response == null) {
            return Optional.empty();
        }
        return parseNumbered(response, sourceStrings);
    }

    private Optional<List<String>> parseNumbered(String response, List<String> sourceStrings) {
        Map<Integer, String> numbered = new TreeMap<>();
        for (String line : response.split("\\R")) {
            Matcher matcher = NUMBERED_LINE.matcher(line);
            if (matcher.matches()) {
                numbered.putIfAbsent(Integer.parseInt(matcher.group(1)), matcher.group(2).strip());
            }
        }
        List<String> result = new ArrayList<>(sourceStrings.size());
        for (int i = 0; i < sourceStrings.size(); i++) {
            String translated = numbered.get(i + 1);
            if (translated == null) {
                return Optional.empty();
            }
            result.add(translated.isEmpty() ? sourceStrings.get(i) : translated);
        }
        return Optional.of(List.copyOf(result));
    }

    private String translateSingle(String source) {
        try {
            String response = model.chat(buildSinglePrompt(source));
            if (response == null) {
                return source;
            }
            String cleaned = response.strip();
            if (cleaned.isEmpty() || cleaned.contains("<text>")) {
                return source;
            }
            return cleaned;
        } catch (RuntimeException ex) {
            rethrowIfFatal(ex);
            LOGGER.warn("Translation failed for '{}': {}", abbreviate(source), ex.getMessage());
            return source;
        }
    }

    private String buildBatchPrompt(List<String> sourceStrings) {
        StringBuilder numbered = new StringBuilder();
        for (int i = 0; i < sourceStrings.size(); i++) {
            numbered.append(i + 1).append(". ").append(sourceStrings.get(i)).append('\n');
        }
        return """
Translate each numbered line below from %s into natural %s. The lines are text from a space game.
Rules:
- Answer with exactly one line per input line, keeping its number and the form `<number>. <translation>`.
- Keep markers such as XPHX0XPHX exactly as they are.
- Do not add commentary, code fences, or blank lines.

""".formatted(sourceLanguage, targetLanguage) + numbered;
    }

    private String buildSinglePrompt(String source) {
        return """
Translate the following text from %s into natural %s.
Keep markers such as XPHX0XPHX exactly as they are.
Return only the translation without additional punctuation or commentary.

<text>
""".formatted(sourceLanguage, targetLanguage) + source + "\n</text>";
    }

    private void rethrowIfFatal(RuntimeException ex) {
        if (hasCause(ex, ModelNotFoundException.class)) {
            throw new TranslationException("%s model '%s' is not available.".formatted(providerName, modelName), ex);
        }
        if (hasCause(ex, RateLimitException.class)) {
            throw new TranslationException("%s rate limit reached: %s".formatted(providerName, ex.getMessage()), ex);
        }
    }

    private static boolean hasCause(Throwable throwable, Class<? extends Throwable> type) {
        Throwable cause = throwable;
        while (cause != null) {
            if (type.isInstance(cause)) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String abbreviate(String value) {
        return value.length() <= 50 ? value : value.substring(0, 50);
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
