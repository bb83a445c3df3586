package ai.gamedata.translator.translate;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Provides the translator for a {@link TranslationMode}. The production translator is built on
 * first use so that runs that never call a model do not need its credentials.
 */
public class TranslatorFactory {

    private final Supplier<Translator> productionTranslator;
    private final Translator dryRunTranslator;
    private final Translator mockTranslator;
    private Translator production;

    public TranslatorFactory(Supplier<Translator> productionTranslator,
                             Translator dryRunTranslator,
                             Translator mockTranslator) {
        this.productionTranslator = Objects.requireNonNull(productionTranslator, "productionTranslator");
        this.dryRunTranslator = Objects.requireNonNull(dryRunTranslator, "dryRunTranslator");
        this.mockTranslator = Objects.requireNonNull(mockTranslator, "mockTranslator");
    }

    public synchronized Translator select(TranslationMode mode) {
        return switch (mode) {
            case PRODUCTION -> production();
            case DRY_RUN -> dryRunTranslator;
            case MOCK -> mockTranslator;
        };
    }

    private Translator production() {
        if (production == null) {
            production = Objects.requireNonNull(productionTranslator.get(), "production translator");
        }
        return production;
    }
}
