package ai.gamedata.translator.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonTranslationCacheStoreTest {

    private final JsonTranslationCacheStore store = new JsonTranslationCacheStore();

    @Test
    void missingFileLoadsAsEmptyCache(@TempDir Path tempDir) {
        TranslationCache cache = store.load(tempDir.resolve("absent.json"));

        assertThat(cache.size()).isZero();
    }

    @Test
    void savedEntriesLoadBackInOrder(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("nested/cache.json");
        TranslationCache cache = new TranslationCache();
        cache.record("Hello", "Привет");
        cache.record("Say \"hi\"", "Скажи 'привет'");

        store.save(file, cache);
        TranslationCache loaded = store.load(file);

        assertThat(loaded.snapshot()).containsExactly(
                entry("Hello", "Привет"),
                entry("Say \"hi\"", "Скажи 'привет'"));
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).contains("Привет");
        assertThat(file.resolveSibling("cache.json.tmp")).doesNotExist();
    }

    @Test
    void readsAFlatJsonObjectWrittenByHand(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("cache.json");
        Files.writeString(file, "{\"Crew\": \"Экипаж\"}", StandardCharsets.UTF_8);

        assertThat(store.load(file).lookup("Crew")).contains("Экипаж");
    }

    @Test
    void malformedFileFailsLoudly(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("cache.json");
        Files.writeString(file, "[not an object", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> store.load(file))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("cache.json");
    }
}
