package ai.gamedata.translator.translate;

import java.util.List;

/**
 * Translation backend. Implementations return one result per input string, in input order;
 * a string the backend could not translate comes back unchanged.
 */
public interface Translator {

    List<String> translate(List<String> sourceStrings);
}
