package ai.gamedata.translator.pipeline;

import ai.gamedata.translator.extract.StringExtractor;
import ai.gamedata.translator.extract.StringTable;
import ai.gamedata.translator.substitute.SpanSubstituter;
import ai.gamedata.translator.substitute.SubstitutionResult;
import ai.gamedata.translator.translate.BatchTranslationService;
import ai.gamedata.translator.translate.TranslationBatchResult;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates one data file: extract, translate, substitute, then write the full result to the
 * mirrored location below the output root.
 */
public class DataFileProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(DataFileProcessor.class);

    private final StringExtractor extractor;
    private final SpanSubstituter substituter;
    private final BatchTranslationService translationService;
    private final Path dataRoot;
    private final Path outputRoot;
    private final boolean dryRun;

    public DataFileProcessor(StringExtractor extractor, SpanSubstituter substituter,
                             BatchTranslationService translationService,
                             Path dataRoot, Path outputRoot, boolean dryRun) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.substituter = Objects.requireNonNull(substituter, "substituter");
        this.translationService = Objects.requireNonNull(translationService, "translationService");
        this.dataRoot = Objects.requireNonNull(dataRoot, "dataRoot").toAbsolutePath().normalize();
        this.outputRoot = Objects.requireNonNull(outputRoot, "outputRoot").toAbsolutePath().normalize();
        this.dryRun = dryRun;
    }

    public FileOutcome process(Path source) {
        if (!isInsideDataRoot(source)) {
            throw new IllegalArgumentException("Data file is outside the data directory " + dataRoot + ": " + source);
        }
        String relativePath = relativize(source);
        String content = read(source);

        StringTable table = extractor.extract(content);
        if (table.isEmpty()) {
            LOGGER.debug("{}: no translatable strings; copying verbatim", relativePath);
            boolean written = write(relativePath, content);
            return new FileOutcome(relativePath, 0, 0, 0, written, Optional.empty());
        }
        LOGGER.info("{}: {} unique strings", relativePath, table.size());

        TranslationBatchResult translations = translationService.translate(table);
        SubstitutionResult substitution = substituter.substitute(content, translations.translations());
        if (substitution.hasMissingKeys()) {
            LOGGER.warn("{}: {} string(s) had no translation and were kept", relativePath, substitution.missingKeys().size());
        }
        if (translations.untranslated() > 0) {
            LOGGER.warn("{}: {} string(s) came back untranslated", relativePath, translations.untranslated());
        }
        boolean written = write(relativePath, substitution.text());
        return new FileOutcome(relativePath, table.size(), translations.untranslated(),
                substitution.missingKeys().size(), written, Optional.empty());
    }

    public Path outputPathFor(String relativePath) {
        return outputRoot.resolve(relativePath);
    }

    /**
     * Path below the data root with forward slashes; a file outside the root keeps its full path
     * so that it can only show up in reports, never as an output location.
     */
    String relativize(Path source) {
        Path absolute = source.toAbsolutePath().normalize();
        if (absolute.startsWith(dataRoot)) {
            return dataRoot.relativize(absolute).toString().replace('\\', '/');
        }
        return absolute.toString();
    }

    private boolean isInsideDataRoot(Path source) {
        Path absolute = source.toAbsolutePath().normalize();
        return absolute.startsWith(dataRoot) && !absolute.equals(dataRoot);
    }

    private String read(Path source) {
        try {
            return Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read data file: " + source, ex);
        }
    }

    private boolean write(String relativePath, String content) {
        if (dryRun) {
            return false;
        }
        Path target = outputPathFor(relativePath);
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, content, StandardCharsets.UTF_8);
            return true;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write translated file: " + target, ex);
        }
    }
}
