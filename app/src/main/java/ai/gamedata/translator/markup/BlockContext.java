package ai.gamedata.translator.markup;

import java.util.Optional;

/**
 * Tag attached to an indentation depth by a block-opening line.
 */
public enum BlockContext {
    OBJECT(null),
    CONVERSATION("conversation"),
    CHOICE("choice"),
    WORD("word"),
    COMMODITY("commodity");

    private final String opener;

    BlockContext(String opener) {
        this.opener = opener;
    }

    public Optional<String> opener() {
        return Optional.ofNullable(opener);
    }

    public boolean isNarrative() {
        return this == CONVERSATION || this == CHOICE;
    }
}
