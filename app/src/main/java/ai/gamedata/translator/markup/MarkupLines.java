package ai.gamedata.translator.markup;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits file text into {@link MarkupLine}s, keeping every original line terminator.
 */
public final class MarkupLines {

    private MarkupLines() {
    }

    public static List<MarkupLine> split(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<MarkupLine> lines = new ArrayList<>();
        int start = 0;
        int index = 0;
        int length = text.length();
        while (start < length) {
            int cursor = start;
            while (cursor < length && text.charAt(cursor) != '\n' && text.charAt(cursor) != '\r') {
                cursor++;
            }
            String body = text.substring(start, cursor);
            int next = cursor;
            if (cursor < length) {
                if (text.charAt(cursor) == '\r' && cursor + 1 < length && text.charAt(cursor + 1) == '\n') {
                    next = cursor + 2;
                } else {
                    next = cursor + 1;
                }
            }
            lines.add(MarkupLine.of(index++, body, text.substring(cursor, next)));
            start = next;
        }
        return List.copyOf(lines);
    }
}
