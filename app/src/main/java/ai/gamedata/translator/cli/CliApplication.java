package ai.gamedata.translator.cli;

import ai.gamedata.translator.cache.JsonTranslationCacheStore;
import ai.gamedata.translator.cache.TranslationCache;
import ai.gamedata.translator.config.Config;
import ai.gamedata.translator.config.ConfigLoader;
import ai.gamedata.translator.config.Secrets;
import ai.gamedata.translator.config.SystemEnvironmentReader;
import ai.gamedata.translator.config.TranslatorConfig;
import ai.gamedata.translator.extract.StringExtractor;
import ai.gamedata.translator.logging.LoggingConfigurator;
import ai.gamedata.translator.markup.MarkupScanner;
import ai.gamedata.translator.pipeline.BatchRunner;
import ai.gamedata.translator.pipeline.DataFileLocator;
import ai.gamedata.translator.pipeline.DataFileProcessor;
import ai.gamedata.translator.pipeline.RunSummary;
import ai.gamedata.translator.substitute.SpanSubstituter;
import ai.gamedata.translator.translate.AlreadyTranslatedPolicy;
import ai.gamedata.translator.translate.BatchTranslationService;
import ai.gamedata.translator.translate.ChatModelTranslator;
import ai.gamedata.translator.translate.MockTranslator;
import ai.gamedata.translator.translate.PassThroughTranslator;
import ai.gamedata.translator.translate.Translator;
import ai.gamedata.translator.translate.TranslatorFactory;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration and the per-file pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FILE_ERRORS = 1;

    private final ConfigLoader configLoader;
    private final JsonTranslationCacheStore cacheStore;
    private final Function<Config, ChatModel> chatModelFactory;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new JsonTranslationCacheStore(), CliApplication::createChatModel);
    }

    CliApplication(ConfigLoader configLoader, JsonTranslationCacheStore cacheStore, Function<Config, ChatModel> chatModelFactory) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.cacheStore = Objects.requireNonNull(cacheStore, "cacheStore");
        this.chatModelFactory = Objects.requireNonNull(chatModelFactory, "chatModelFactory");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), cliArguments.verbose());
        LOGGER.info("Translating {} into {} (mode={}, dryRun={}, cache={})",
                config.dataDir(), config.outputDir(), config.translationMode(), config.dryRun(),
                config.useCache() ? config.cacheFile() : "disabled");

        List<Path> files;
        try {
            files = new DataFileLocator(config.dataDir()).locate(config.singleFile().orElse(null));
        } catch (RuntimeException ex) {
            LOGGER.error("Cannot list data files: {}", ex.getMessage());
            return EXIT_FILE_ERRORS;
        }

        TranslationCache cache = config.useCache() ? cacheStore.load(config.cacheFile()) : new TranslationCache();
        BatchRunner runner = new BatchRunner(createProcessor(config, cache), config.parallelism());
        RunSummary summary = runner.run(files);

        if (config.writesCache()) {
            cacheStore.save(config.cacheFile(), cache);
        }
        if (summary.hasErrors()) {
            LOGGER.warn("Failed files: {}", String.join(", ", summary.failedFiles()));
            return EXIT_FILE_ERRORS;
        }
        return EXIT_OK;
    }

    private DataFileProcessor createProcessor(Config config, TranslationCache cache) {
        TranslatorFactory factory = new TranslatorFactory(() -> createProductionTranslator(config),
                new PassThroughTranslator(), new MockTranslator());
        BatchTranslationService translationService = new BatchTranslationService(factory,
                config.translationMode(), cache, new AlreadyTranslatedPolicy(), config.skipTranslated(),
                config.batchSize(),
                config.llmMaxRetryAttempts(),
                config.llmInitialBackoffSeconds(),
                config.llmMaxBackoffSeconds(),
                config.llmRetryJitterFactor());
        MarkupScanner scanner = new MarkupScanner();
        return new DataFileProcessor(new StringExtractor(scanner), new SpanSubstituter(scanner),
                translationService, config.dataDir(), config.outputDir(), config.dryRun());
    }

    private Translator createProductionTranslator(Config config) {
        TranslatorConfig translatorConfig = config.translatorConfig();
        return new ChatModelTranslator(chatModelFactory.apply(config), translatorConfig.provider().name(),
                translatorConfig.modelName(), translatorConfig.sourceLanguage(), translatorConfig.targetLanguage());
    }

    private static ChatModel createChatModel(Config config) {
        TranslatorConfig translatorConfig = config.translatorConfig();
        return switch (translatorConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(translatorConfig);
            case GEMINI -> createGeminiChatModel(translatorConfig, config.secrets());
        };
    }

    private static ChatModel createOllamaChatModel(TranslatorConfig translatorConfig) {
        try {
            String baseUrl = translatorConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", translatorConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private static ChatModel createGeminiChatModel(TranslatorConfig translatorConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", translatorConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
