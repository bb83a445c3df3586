package ai.gamedata.translator.markup;

import java.util.Set;

/**
 * Fixed leading-token vocabularies consulted by {@link LineClassifier}.
 */
public final class Keywords {

    /** Lines starting with these tokens are pure syntax. */
    public static final Set<String> CONTROL = Set.of(
            "branch", "label", "goto", "decline", "accept", "fail",
            "job", "deadline", "invisible", "landing", "non-blocking",
            "random", "set", "apply", "mark", "unmark", "visit", "enter",
            "weight", "engine", "gun", "turret", "outfits",
            "on", "to", "has", "not", "and", "or", "action");

    /** Fields whose value names another entity. */
    public static final Set<String> REFERENCE = Set.of(
            "category", "series", "thumbnail", "sprite", "government", "names",
            "system", "planet", "fleet", "ship", "conversation", "phrase", "event",
            "source", "destination", "stopover", "clearance", "blocked", "formation",
            "account", "date", "credits", "score", "mortgage", "principal",
            "interest", "term", "plural", "swizzle", "color", "language", "type",
            "npc", "personality", "variant", "repeat", "index", "cost",
            "licenses", "logbook", "news", "portrait", "location", "attributes",
            "filters", "filter");

    /** Fields whose every quoted argument is display text. */
    public static final Set<String> ALWAYS_TRANSLATE = Set.of("log", "dialog");

    public static final String WORD = "word";
    public static final String COMMODITY = "commodity";
    public static final String CONVERSATION = "conversation";
    public static final String CHOICE = "choice";
    public static final String DIALOG = "dialog";
    public static final String PHRASE = "phrase";

    private Keywords() {
    }
}
