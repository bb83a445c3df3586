package ai.gamedata.translator.markup;

import java.util.Objects;

/**
 * One physical line of a data file with its original terminator and tab-counted depth.
 */
public record MarkupLine(int index, String body, String terminator, int depth, String content) {

    private static final String COMMENT_MARKER = "#";

    public MarkupLine {
        Objects.requireNonNull(body, "body");
        terminator = terminator == null ? "" : terminator;
        content = content == null ? "" : content;
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be zero or greater");
        }
    }

    public static MarkupLine of(int index, String body, String terminator) {
        return new MarkupLine(index, body, terminator, countTabs(body), body.strip());
    }

    public String raw() {
        return body + terminator;
    }

    /**
     * Offset of the first character of {@link #content()} inside {@link #body()}.
     */
    public int contentOffset() {
        return content.isEmpty() ? body.length() : body.indexOf(content);
    }

    public boolean isInert() {
        return content.isEmpty() || content.startsWith(COMMENT_MARKER);
    }

    static int countTabs(String text) {
        int count = 0;
        while (count < text.length() && text.charAt(count) == '\t') {
            count++;
        }
        return count;
    }
}
