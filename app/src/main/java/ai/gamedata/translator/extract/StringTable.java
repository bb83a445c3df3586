package ai.gamedata.translator.extract;

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Unique translatable strings of one file in first-occurrence order.
 */
public final class StringTable implements Iterable<String> {

    private static final StringTable EMPTY = new StringTable(List.of());

    private final List<String> entries;

    private StringTable(List<String> entries) {
        this.entries = entries;
    }

    public static StringTable empty() {
        return EMPTY;
    }

    /**
     * Builds a table from raw extracted strings, trimming them and dropping blanks and repeats.
     */
    public static StringTable of(Collection<String> strings) {
        Set<String> unique = new LinkedHashSet<>();
        for (String value : strings) {
            if (value == null) {
                continue;
            }
            String trimmed = value.strip();
            if (!trimmed.isEmpty()) {
                unique.add(trimmed);
            }
        }
        return unique.isEmpty() ? EMPTY : new StringTable(List.copyOf(unique));
    }

    public List<String> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public boolean contains(String value) {
        return entries.contains(value);
    }

    @Override
    public Iterator<String> iterator() {
        return entries.iterator();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof StringTable table && entries.equals(table.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "StringTable" + entries;
    }
}
