package ai.gamedata.translator.markup;

import java.util.Objects;

/**
 * Interior of a delimited literal, as offsets into a line body. {@code start} is the first
 * character after the opening delimiter and {@code end} is the index of the closing one.
 */
public record QuotedSpan(Delimiter delimiter, int start, int end) {

    public QuotedSpan {
        Objects.requireNonNull(delimiter, "delimiter");
        if (start < 1 || end < start) {
            throw new IllegalArgumentException("Invalid span bounds: " + start + ".." + end);
        }
    }

    public String interior(String body) {
        return body.substring(start, end);
    }

    public String trimmed(String body) {
        return interior(body).strip();
    }

    QuotedSpan shift(int offset) {
        return new QuotedSpan(delimiter, start + offset, end + offset);
    }
}
