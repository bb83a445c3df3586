package ai.gamedata.translator.markup;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Kinds of top-level objects. Each kind carries the field names whose values are display text.
 */
public enum ObjectType {
    OUTFIT(Set.of("description")),
    SHIP(Set.of("description")),
    MISSION(Set.of("name", "description")),
    CONVERSATION(Set.of()),
    PHRASE(Set.of()),
    GOVERNMENT(Set.of()),
    PLANET(Set.of("description", "spaceport")),
    SYSTEM(Set.of()),
    FLEET(Set.of()),
    EVENT(Set.of()),
    PERSON(Set.of()),
    START(Set.of("name", "description")),
    TRADE(Set.of()),
    CATEGORY(Set.of()),
    GAMERULES(Set.of()),
    INTERFACE(Set.of()),
    NEWS(Set.of()),
    HAZARD(Set.of()),
    MINABLE(Set.of()),
    FORMATION(Set.of());

    private final Set<String> translatableFields;

    ObjectType(Set<String> translatableFields) {
        this.translatableFields = translatableFields;
    }

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTranslatableField(String token) {
        return translatableFields.contains(token);
    }

    public Set<String> translatableFields() {
        return translatableFields;
    }

    public static Optional<ObjectType> fromKeyword(String token) {
        if (token == null || token.isEmpty()) {
            return Optional.empty();
        }
        for (ObjectType type : values()) {
            if (type.keyword().equals(token)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
