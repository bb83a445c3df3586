package ai.gamedata.translator.translate;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Best-effort check for strings that already read as target-language text: at least one
 * target-script character and no source-script letters. Mixed-language strings are sent to
 * the translator.
 */
public class AlreadyTranslatedPolicy {

    public static final Pattern CYRILLIC = Pattern.compile("[А-Яа-яЁё]");
    public static final Pattern LATIN = Pattern.compile("[A-Za-z]");

    private final Pattern targetScript;
    private final Pattern sourceScript;

    public AlreadyTranslatedPolicy() {
        this(CYRILLIC, LATIN);
    }

    public AlreadyTranslatedPolicy(Pattern targetScript, Pattern sourceScript) {
        this.targetScript = Objects.requireNonNull(targetScript, "targetScript");
        this.sourceScript = Objects.requireNonNull(sourceScript, "sourceScript");
    }

    public boolean isAlreadyTranslated(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        return targetScript.matcher(text).find() && !sourceScript.matcher(text).find();
    }

    /**
     * An unchanged result that still holds source-script letters most likely was never
     * translated; such results must not be remembered as done.
     */
    public boolean looksUntranslated(String source, String result) {
        return Objects.equals(source, result) && sourceScript.matcher(source).find();
    }
}
