package ai.gamedata.translator.substitute;

/**
 * Makes replacement text safe to place between literal delimiters: both delimiter characters
 * become an apostrophe and line breaks become spaces.
 */
public final class QuoteSanitizer {

    static final char NEUTRAL = '\'';

    private QuoteSanitizer() {
    }

    public static String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            switch (ch) {
                case '"', '`' -> builder.append(NEUTRAL);
                case '\r' -> {
                    if (i + 1 >= text.length() || text.charAt(i + 1) != '\n') {
                        builder.append(' ');
                    }
                }
                case '\n' -> builder.append(' ');
                default -> builder.append(ch);
            }
        }
        return builder.toString();
    }
}
