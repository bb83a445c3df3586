package ai.gamedata.translator.markup;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Positional helpers locating delimited literals in the trimmed content of a line.
 * Returned spans are relative to the content string; an opening delimiter without a
 * closing one on the same line never yields a span.
 */
final class QuotedSpans {

    private QuotedSpans() {
    }

    /**
     * First literal of either delimiter kind, chosen by whichever opening delimiter comes first.
     */
    static Optional<QuotedSpan> first(String text) {
        int doubleQuote = text.indexOf('"');
        int backtick = text.indexOf('`');
        if (doubleQuote < 0 && backtick < 0) {
            return Optional.empty();
        }
        int position;
        if (doubleQuote < 0) {
            position = backtick;
        } else if (backtick < 0) {
            position = doubleQuote;
        } else {
            position = Math.min(doubleQuote, backtick);
        }
        return closeAt(text, position);
    }

    static Optional<QuotedSpan> firstBacktick(String text) {
        int position = text.indexOf('`');
        if (position < 0) {
            return Optional.empty();
        }
        return closeAt(text, position);
    }

    static List<QuotedSpan> all(String text) {
        List<QuotedSpan> spans = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            if (Delimiter.isDelimiter(text.charAt(i))) {
                Optional<QuotedSpan> span = closeAt(text, i);
                if (span.isPresent()) {
                    spans.add(span.get());
                    i = span.get().end() + 1;
                    continue;
                }
            }
            i++;
        }
        return spans;
    }

    /**
     * Literal directly following {@code keyword} (whitespace allowed in between), as in
     * {@code description `text`}.
     */
    static Optional<QuotedSpan> fieldValue(String text, String keyword) {
        int cursor = keyword.length();
        while (cursor < text.length() && Character.isWhitespace(text.charAt(cursor))) {
            cursor++;
        }
        if (cursor >= text.length() || !Delimiter.isDelimiter(text.charAt(cursor))) {
            return Optional.empty();
        }
        return closeAt(text, cursor);
    }

    /**
     * True for {@code "key" value}: the line opens with a literal that is followed by more
     * content. An unclosed opening literal counts as no trailing content.
     */
    static boolean hasTrailingContent(String text) {
        if (text.isEmpty() || !Delimiter.isDelimiter(text.charAt(0))) {
            return false;
        }
        int close = text.indexOf(text.charAt(0), 1);
        if (close < 0) {
            return false;
        }
        return !text.substring(close + 1).isBlank();
    }

    static boolean startsWithDelimiter(String text) {
        return !text.isEmpty() && Delimiter.isDelimiter(text.charAt(0));
    }

    private static Optional<QuotedSpan> closeAt(String text, int open) {
        char symbol = text.charAt(open);
        int close = text.indexOf(symbol, open + 1);
        if (close < 0) {
            return Optional.empty();
        }
        return Delimiter.of(symbol).map(delimiter -> new QuotedSpan(delimiter, open + 1, close));
    }
}
