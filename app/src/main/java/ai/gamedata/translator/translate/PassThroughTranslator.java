package ai.gamedata.translator.translate;

import java.util.List;

/**
 * Dry-run translator: every string maps to itself and no remote API is touched.
 */
public class PassThroughTranslator implements Translator {

    @Override
    public List<String> translate(List<String> sourceStrings) {
        if (sourceStrings == null) {
            return List.of();
        }
        return List.copyOf(sourceStrings);
    }
}
