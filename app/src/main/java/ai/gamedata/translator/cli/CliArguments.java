package ai.gamedata.translator.cli;

import ai.gamedata.translator.config.LogFormat;
import ai.gamedata.translator.translate.TranslationMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "gamedata-translator", mixinStandardHelpOptions = true, version = "gamedata-translator 1.0.0",
        description = "Translates the display text of tab-indented game data files, leaving identifiers and syntax untouched")
public class CliArguments {

    @CommandLine.Option(names = "--data-dir", description = "Root directory of the source data files (default: data)", paramLabel = "DIR")
    private Path dataDir;

    @CommandLine.Option(names = "--output-dir", description = "Directory receiving translated files, mirroring the data layout", paramLabel = "DIR")
    private Path outputDir;

    @CommandLine.Option(names = "--cache-file", description = "JSON file holding previously translated strings", paramLabel = "FILE")
    private Path cacheFile;

    @CommandLine.Option(names = "--file", description = "Single file path relative to the data directory (e.g. human/outfits.txt)", paramLabel = "PATH")
    private String file;

    @CommandLine.Option(names = "--dry-run", description = "Collect and count strings without calling a model or writing files")
    private boolean dryRun;

    @CommandLine.Option(names = "--no-cache", description = "Neither load nor save the translation cache")
    private boolean noCache;

    @CommandLine.Option(names = "--skip-translated", description = "Keep strings that already look translated")
    private boolean skipTranslated;

    @CommandLine.Option(names = "--translation-mode", description = "Translator to use: production, dry-run, or mock", converter = TranslationModeConverter.class)
    private TranslationMode translationMode;

    @CommandLine.Option(names = "--batch-size", description = "Strings per translation request (default: 32)", paramLabel = "COUNT")
    private Integer batchSize;

    @CommandLine.Option(names = "--parallelism", description = "Number of files processed concurrently (default: 1)", paramLabel = "COUNT")
    private Integer parallelism;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log per-batch and per-file details")
    private boolean verbose;

    public Path dataDir() {
        return dataDir;
    }

    public Path outputDir() {
        return outputDir;
    }

    public Path cacheFile() {
        return cacheFile;
    }

    public String file() {
        return file;
    }

    public boolean dryRun() {
        return dryRun;
    }

    public boolean noCache() {
        return noCache;
    }

    public boolean skipTranslated() {
        return skipTranslated;
    }

    public TranslationMode translationMode() {
        return translationMode;
    }

    public Integer batchSize() {
        return batchSize;
    }

    public Integer parallelism() {
        return parallelism;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
