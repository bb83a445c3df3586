package ai.gamedata.translator.markup;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a file line by line, keeping the context tracker current and handing each line and
 * its classification to a visitor. Extraction and substitution are both visitors of this walk.
 */
public class MarkupScanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(MarkupScanner.class);

    private final LineClassifier classifier;

    public MarkupScanner() {
        this(new LineClassifier());
    }

    public MarkupScanner(LineClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public void scan(String text, LineVisitor visitor) {
        Objects.requireNonNull(visitor, "visitor");
        ContextTracker tracker = new ContextTracker();
        List<MarkupLine> lines = MarkupLines.split(text);
        for (MarkupLine line : lines) {
            if (line.isInert()) {
                visitor.visit(line, Classification.SKIP);
                continue;
            }
            tracker.enter(line.depth());
            Classification classification = classifier.classify(line, tracker);
            tracker.apply(classification);
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("line {} depth {} -> {}", line.index() + 1, line.depth(), classification);
            }
            visitor.visit(line, classification);
        }
        LOGGER.debug("Scanned {} lines", lines.size());
    }
}
