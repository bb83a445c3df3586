package ai.gamedata.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChatModelTranslatorTest {

    @Test
    @DisplayName("Maps a numbered reply back onto the batch")
    void parsesNumberedBatchReply() {
        List<String> prompts = new ArrayList<>();
        ChatModel stubModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                prompts.add(prompt);
                return "1. Привет\n2) Мир  \n";
            }
        };
        ChatModelTranslator translator = translator(stubModel);

        List<String> result = translator.translate(List.of("Hello", "World"));

        assertThat(result).containsExactly("Привет", "Мир");
        assertThat(prompts).hasSize(1);
        assertThat(prompts.get(0)).contains("1. Hello", "2. World", "English", "Russian");
    }

    @Test
    @DisplayName("Falls back to one request per string when the reply misses numbers")
    void fallsBackToSingleRequests() {
        List<String> prompts = new ArrayList<>();
        ChatModel stubModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                prompts.add(prompt);
                if (prompt.contains("numbered line")) {
                    return "1. Только одна строка";
                }
                return prompt.contains("Hello") ? " Привет \n" : "Мир";
            }
        };
        ChatModelTranslator translator = translator(stubModel);

        List<String> result = translator.translate(List.of("Hello", "World"));

        assertThat(result).containsExactly("Привет", "Мир");
        assertThat(prompts).hasSize(3);
    }

    @Test
    @DisplayName("Keeps the source when a single reply is empty or echoes the prompt")
    void keepsSourceForUnusableSingleReply() {
        ChatModel emptyModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                return "   ";
            }
        };
        ChatModel echoingModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                return prompt;
            }
        };

        assertThat(translator(emptyModel).translate(List.of("Hello"))).containsExactly("Hello");
        assertThat(translator(echoingModel).translate(List.of("Hello"))).containsExactly("Hello");
    }

    @Test
    @DisplayName("Ordinary model errors keep the source string")
    void keepsSourceOnModelError() {
        ChatModel failingModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                throw new IllegalStateException("connection reset");
            }
        };

        assertThat(translator(failingModel).translate(List.of("One", "Two"))).containsExactly("One", "Two");
    }

    @Test
    @DisplayName("Missing model and rate limits surface as TranslationException")
    void fatalErrorsPropagate() {
        ChatModel missingModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                throw new ModelNotFoundException("model not found");
            }
        };
        ChatModel limitedModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                throw new RuntimeException("wrapped", new RateLimitException("429 Too Many Requests"));
            }
        };

        assertThatThrownBy(() -> translator(missingModel).translate(List.of("Hello")))
                .isInstanceOf(TranslationException.class)
                .hasMessageContaining("test-model");
        assertThatThrownBy(() -> translator(limitedModel).translate(List.of("One", "Two")))
                .isInstanceOf(TranslationException.class)
                .hasMessageContaining("rate limit");
    }

    @Test
    void emptyInputNeverCallsTheModel() {
        ChatModel unusedModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                throw new AssertionError("model should not be called");
            }
        };

        assertThat(translator(unusedModel).translate(List.of())).isEmpty();
    }

    @Test
    void rejectsBlankLanguages() {
        ChatModel model = new ChatModel() {
            @Override
            public String chat(String prompt) {
                return prompt;
            }
        };

        assertThatThrownBy(() -> new ChatModelTranslator(model, "Ollama", "m", " ", "Russian"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sourceLanguage");
    }

    private static ChatModelTranslator translator(ChatModel model) {
        return new ChatModelTranslator(model, "TestProvider", "test-model", "English", "Russian");
    }
}
