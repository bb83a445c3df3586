package ai.gamedata.translator.translate;

/**
 * Unchecked failure of the translation backend.
 */
public class TranslationException extends RuntimeException {

    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
