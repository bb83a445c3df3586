package ai.gamedata.translator.translate;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Swaps {@code <...>} placeholders for plain ASCII markers before translation and puts them back
 * afterwards, so that a backend cannot translate or reformat them.
 */
public final class PlaceholderProtector {

    private static final Pattern PLACEHOLDER = Pattern.compile("<[^>]+>");
    private static final String MARKER_EDGE = "XPHX";

    private PlaceholderProtector() {
    }

    public static Protected protect(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder builder = new StringBuilder(text.length());
        while (matcher.find()) {
            matcher.appendReplacement(builder, Matcher.quoteReplacement(marker(tokens.size())));
            tokens.add(matcher.group());
        }
        matcher.appendTail(builder);
        return new Protected(builder.toString(), List.copyOf(tokens));
    }

    public static String restore(String text, List<String> tokens) {
        if (text == null) {
            return null;
        }
        String restored = text;
        for (int i = 0; i < tokens.size(); i++) {
            restored = restored.replace(marker(i), tokens.get(i));
        }
        return restored;
    }

    private static String marker(int index) {
        return MARKER_EDGE + index + MARKER_EDGE;
    }

    /**
     * Text with markers in place of its placeholders, in order of appearance.
     */
    public record Protected(String text, List<String> tokens) {

        public String restore(String translated) {
            return PlaceholderProtector.restore(translated, tokens);
        }
    }
}
