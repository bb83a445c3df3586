package ai.gamedata.translator.translate;

import java.util.ArrayList;
import java.util.List;

/**
 * Marks each string with a visible prefix so substituted spans can be spotted in the output.
 */
public class MockTranslator implements Translator {

    static final String MARKER = "[TR]";

    @Override
    public List<String> translate(List<String> sourceStrings) {
        List<String> result = new ArrayList<>(sourceStrings.size());
        for (String value : sourceStrings) {
            result.add(MARKER + value);
        }
        return result;
    }
}
