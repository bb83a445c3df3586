package ai.gamedata.translator.markup;

import java.util.List;
import java.util.Objects;

/**
 * Disposition of a single line, produced by {@link LineClassifier} and shared by both passes.
 */
public sealed interface Classification {

    Classification SKIP = new Skip();
    Classification LEAVE_OBJECT = new LeaveObject();

    /** The line carries no translatable content and opens nothing. */
    record Skip() implements Classification {
    }

    /** A block opener: deeper lines are read under {@code context}. */
    record OpenContext(int depth, BlockContext context) implements Classification {

        public OpenContext {
            Objects.requireNonNull(context, "context");
        }
    }

    /** A depth-0 line declaring an object of a known kind. */
    record EnterObject(ObjectType type) implements Classification {

        public EnterObject {
            Objects.requireNonNull(type, "type");
        }
    }

    /** A depth-0 line that is not a known object declaration. */
    record LeaveObject() implements Classification {
    }

    /** Spans of the line body whose interiors are display text. Never empty. */
    record Translate(List<QuotedSpan> spans) implements Classification {

        public Translate {
            spans = List.copyOf(spans);
            if (spans.isEmpty()) {
                throw new IllegalArgumentException("spans must not be empty");
            }
        }
    }
}
