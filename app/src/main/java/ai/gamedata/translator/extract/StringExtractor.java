package ai.gamedata.translator.extract;

import ai.gamedata.translator.markup.Classification;
import ai.gamedata.translator.markup.MarkupScanner;
import ai.gamedata.translator.markup.QuotedSpan;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * First pass: collects the translatable strings of a file without touching it.
 */
public class StringExtractor {

    private final MarkupScanner scanner;

    public StringExtractor() {
        this(new MarkupScanner());
    }

    public StringExtractor(MarkupScanner scanner) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
    }

    public StringTable extract(String text) {
        List<String> strings = spans(text).stream()
                .map(LocatedSpan::text)
                .collect(Collectors.toList());
        return StringTable.of(strings);
    }

    /**
     * Every translatable span in file order, repeats included.
     */
    public List<LocatedSpan> spans(String text) {
        List<LocatedSpan> located = new ArrayList<>();
        scanner.scan(text, (line, classification) -> {
            if (classification instanceof Classification.Translate translate) {
                for (QuotedSpan span : translate.spans()) {
                    located.add(new LocatedSpan(line.index(), span, span.trimmed(line.body())));
                }
            }
        });
        return located;
    }
}
