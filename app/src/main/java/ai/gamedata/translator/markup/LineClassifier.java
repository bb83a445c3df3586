package ai.gamedata.translator.markup;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Decides what a single line means given the contexts opened by the lines before it.
 *
 * <p>Rules are evaluated in a fixed order and the first one that matches wins. The classifier
 * only reads the tracker; applying an {@link Classification.OpenContext} or object change is
 * left to the caller, so the same line under the same tracker state always yields the same
 * result.
 */
public class LineClassifier {

    public Classification classify(MarkupLine line, ContextTracker tracker) {
        if (line.isInert()) {
            return Classification.SKIP;
        }
        String content = line.content();
        String token = firstToken(content);
        if (line.depth() == 0) {
            return ObjectType.fromKeyword(token)
                    .<Classification>map(Classification.EnterObject::new)
                    .orElse(Classification.LEAVE_OBJECT);
        }
        int offset = line.contentOffset();
        char lead = content.charAt(0);

        // narrative text or choice option
        if (lead == '`') {
            if (!tracker.narrativeAllowed()) {
                return Classification.SKIP;
            }
            return translate(content, offset, QuotedSpans.firstBacktick(content));
        }

        // standalone quoted narrative; "key" value pairs stay untouched
        if (lead == '"' && tracker.inConversation()) {
            if (QuotedSpans.hasTrailingContent(content)) {
                return Classification.SKIP;
            }
            return translate(content, offset, QuotedSpans.first(content));
        }

        if (Keywords.CONTROL.contains(token)) {
            return Classification.SKIP;
        }

        if (Keywords.WORD.equals(token)) {
            return new Classification.OpenContext(line.depth(), BlockContext.WORD);
        }

        if (Keywords.CONVERSATION.equals(token) || Keywords.CHOICE.equals(token)) {
            String argument = content.substring(token.length()).strip();
            if (QuotedSpans.startsWithDelimiter(argument)) {
                // named reference, not an inline block
                return Classification.SKIP;
            }
            BlockContext context = Keywords.CHOICE.equals(token) ? BlockContext.CHOICE : BlockContext.CONVERSATION;
            return new Classification.OpenContext(line.depth(), context);
        }

        if (Keywords.COMMODITY.equals(token)) {
            return new Classification.OpenContext(line.depth(), BlockContext.COMMODITY);
        }

        if (tracker.contains(BlockContext.WORD)) {
            if (!QuotedSpans.startsWithDelimiter(content)) {
                return Classification.SKIP;
            }
            return translate(content, offset, QuotedSpans.first(content));
        }

        if (tracker.contains(BlockContext.COMMODITY)) {
            if (lead != '"' || QuotedSpans.hasTrailingContent(content)) {
                return Classification.SKIP;
            }
            return translate(content, offset, QuotedSpans.first(content));
        }

        if (tracker.isObject(ObjectType.CATEGORY) && line.depth() == 1 && lead == '"') {
            if (QuotedSpans.hasTrailingContent(content)) {
                return Classification.SKIP;
            }
            return translate(content, offset, QuotedSpans.first(content));
        }

        if (Keywords.ALWAYS_TRANSLATE.contains(token)) {
            if (isDialogPhraseReference(content, token)) {
                return Classification.SKIP;
            }
            return translate(content, offset, QuotedSpans.all(content));
        }

        if (lead == '"') {
            return Classification.SKIP;
        }

        if (Keywords.REFERENCE.contains(token)) {
            return Classification.SKIP;
        }

        Optional<ObjectType> objectType = tracker.objectType();
        if (objectType.isPresent() && objectType.get().isTranslatableField(token)) {
            return translate(content, offset, QuotedSpans.fieldValue(content, token));
        }
        return Classification.SKIP;
    }

    static String firstToken(String content) {
        int end = 0;
        while (end < content.length() && !Character.isWhitespace(content.charAt(end))) {
            end++;
        }
        return content.substring(0, end);
    }

    /**
     * {@code dialog phrase "id"} points at a phrase definition instead of carrying text.
     */
    private static boolean isDialogPhraseReference(String content, String token) {
        if (!Keywords.DIALOG.equals(token)) {
            return false;
        }
        String rest = content.substring(token.length()).strip();
        if (!rest.startsWith(Keywords.PHRASE) || rest.length() == Keywords.PHRASE.length()) {
            return false;
        }
        if (!Character.isWhitespace(rest.charAt(Keywords.PHRASE.length()))) {
            return false;
        }
        // decided by the character after "phrase" only, which lies outside every literal
        String argument = rest.substring(Keywords.PHRASE.length()).strip();
        return QuotedSpans.startsWithDelimiter(argument);
    }

    private static Classification translate(String content, int offset, Optional<QuotedSpan> span) {
        return translate(content, offset, span.map(List::of).orElse(List.of()));
    }

    private static Classification translate(String content, int offset, List<QuotedSpan> spans) {
        List<QuotedSpan> located = spans.stream()
                .filter(span -> !span.interior(content).isBlank())
                .map(span -> span.shift(offset))
                .collect(Collectors.toList());
        if (located.isEmpty()) {
            return Classification.SKIP;
        }
        return new Classification.Translate(located);
    }
}
