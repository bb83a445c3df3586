package ai.gamedata.translator.cli;

import ai.gamedata.translator.translate.TranslationMode;
import picocli.CommandLine;

/**
 * Accepts {@code production}, {@code dry-run} and {@code mock} in any case.
 */
public class TranslationModeConverter implements CommandLine.ITypeConverter<TranslationMode> {

    @Override
    public TranslationMode convert(String value) {
        try {
            return TranslationMode.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }
}
