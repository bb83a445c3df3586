package ai.gamedata.translator.markup;

import java.util.Optional;

/**
 * String literal delimiters of the data format.
 */
public enum Delimiter {
    DOUBLE_QUOTE('"'),
    BACKTICK('`');

    private final char symbol;

    Delimiter(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    public static Optional<Delimiter> of(char ch) {
        return switch (ch) {
            case '"' -> Optional.of(DOUBLE_QUOTE);
            case '`' -> Optional.of(BACKTICK);
            default -> Optional.empty();
        };
    }

    public static boolean isDelimiter(char ch) {
        return ch == '"' || ch == '`';
    }
}
