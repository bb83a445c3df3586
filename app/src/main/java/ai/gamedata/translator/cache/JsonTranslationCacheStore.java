package ai.gamedata.translator.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists a {@link TranslationCache} as a flat JSON object.
 */
public class JsonTranslationCacheStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonTranslationCacheStore.class);
    private static final TypeReference<LinkedHashMap<String, String>> ENTRIES_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JsonTranslationCacheStore() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public JsonTranslationCacheStore(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public TranslationCache load(Path file) {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            LOGGER.info("No translation cache at {}; starting empty", file);
            return new TranslationCache();
        }
        try {
            LinkedHashMap<String, String> entries = objectMapper.readValue(file.toFile(), ENTRIES_TYPE);
            TranslationCache cache = new TranslationCache(entries);
            LOGGER.info("Loaded {} cached translations from {}", cache.size(), file);
            return cache;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read translation cache: " + file, ex);
        }
    }

    /**
     * Writes to a sibling temporary file first and moves it into place.
     */
    public void save(Path file, TranslationCache cache) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(cache, "cache");
        Path absolute = file.toAbsolutePath();
        Path temporary = absolute.resolveSibling(absolute.getFileName() + ".tmp");
        try {
            Files.createDirectories(absolute.getParent());
            objectMapper.writeValue(temporary.toFile(), cache.snapshot());
            Files.move(temporary, absolute, StandardCopyOption.REPLACE_EXISTING);
            LOGGER.info("Saved {} translations to {}", cache.size(), file);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write translation cache: " + file, ex);
        }
    }
}
