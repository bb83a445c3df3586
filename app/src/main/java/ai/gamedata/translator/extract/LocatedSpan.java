package ai.gamedata.translator.extract;

import ai.gamedata.translator.markup.QuotedSpan;
import java.util.Objects;

/**
 * A translatable span found on a given line, with its trimmed text.
 */
public record LocatedSpan(int lineIndex, QuotedSpan span, String text) {

    public LocatedSpan {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(text, "text");
    }
}
