package ai.gamedata.translator.substitute;

import ai.gamedata.translator.markup.Classification;
import ai.gamedata.translator.markup.MarkupLine;
import ai.gamedata.translator.markup.MarkupScanner;
import ai.gamedata.translator.markup.QuotedSpan;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Second pass: rewrites the interiors of translatable spans and copies every other byte.
 */
public class SpanSubstituter {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpanSubstituter.class);

    private final MarkupScanner scanner;

    public SpanSubstituter() {
        this(new MarkupScanner());
    }

    public SpanSubstituter(MarkupScanner scanner) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
    }

    public SubstitutionResult substitute(String text, Map<String, String> translations) {
        Objects.requireNonNull(translations, "translations");
        if (text == null || text.isEmpty()) {
            return new SubstitutionResult("", 0, List.of());
        }
        StringBuilder output = new StringBuilder(text.length() + 256);
        Set<String> missing = new LinkedHashSet<>();
        int[] replaced = {0};
        scanner.scan(text, (line, classification) -> {
            if (classification instanceof Classification.Translate translate) {
                output.append(rewrite(line, translate.spans(), translations, missing, replaced));
                output.append(line.terminator());
            } else {
                output.append(line.raw());
            }
        });
        if (!missing.isEmpty()) {
            LOGGER.debug("{} span(s) kept their original text: no translation supplied", missing.size());
        }
        return new SubstitutionResult(output.toString(), replaced[0], List.copyOf(missing));
    }

    private String rewrite(MarkupLine line, List<QuotedSpan> spans, Map<String, String> translations,
                           Set<String> missing, int[] replaced) {
        String body = line.body();
        StringBuilder builder = new StringBuilder(body.length() + 64);
        int cursor = 0;
        for (QuotedSpan span : spans) {
            builder.append(body, cursor, span.start());
            String interior = span.interior(body);
            String key = interior.strip();
            String translated = translations.get(key);
            if (translated == null) {
                missing.add(key);
                builder.append(interior);
            } else if (translated.equals(key) || translated.isBlank()) {
                builder.append(interior);
            } else {
                int leading = interior.indexOf(key);
                builder.append(interior, 0, leading)
                        .append(QuoteSanitizer.sanitize(translated.strip()))
                        .append(interior, leading + key.length(), interior.length());
                replaced[0]++;
            }
            cursor = span.end();
        }
        builder.append(body, cursor, body.length());
        return builder.toString();
    }
}
