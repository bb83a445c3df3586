package ai.gamedata.translator.markup;

import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Block contexts keyed by indentation depth. The format has no closing tokens, so a line at
 * depth {@code D} closes every context opened at depth {@code D} or deeper.
 */
public final class ContextTracker {

    private final NavigableMap<Integer, BlockContext> contexts = new TreeMap<>();
    private ObjectType objectType;

    public void enter(int depth) {
        contexts.tailMap(depth, true).clear();
    }

    public void open(int depth, BlockContext context) {
        Objects.requireNonNull(context, "context");
        contexts.tailMap(depth, true).clear();
        contexts.put(depth, context);
    }

    public void enterObject(ObjectType type) {
        objectType = Objects.requireNonNull(type, "type");
        contexts.clear();
        contexts.put(0, BlockContext.OBJECT);
    }

    public void leaveObject() {
        objectType = null;
        contexts.clear();
    }

    public void apply(Classification classification) {
        if (classification instanceof Classification.OpenContext open) {
            open(open.depth(), open.context());
        } else if (classification instanceof Classification.EnterObject enter) {
            enterObject(enter.type());
        } else if (classification instanceof Classification.LeaveObject) {
            leaveObject();
        }
    }

    public Optional<ObjectType> objectType() {
        return Optional.ofNullable(objectType);
    }

    public boolean isObject(ObjectType type) {
        return objectType == type;
    }

    public boolean contains(BlockContext context) {
        return contexts.containsValue(context);
    }

    /**
     * True under a bare {@code conversation}/{@code choice} block or inside a top-level conversation.
     */
    public boolean inConversation() {
        return objectType == ObjectType.CONVERSATION
                || contexts.values().stream().anyMatch(BlockContext::isNarrative);
    }

    /** Backtick lines are display text here. */
    public boolean narrativeAllowed() {
        return inConversation() || contains(BlockContext.WORD);
    }

    public Map<Integer, BlockContext> snapshot() {
        return Map.copyOf(contexts);
    }

    public void reset() {
        contexts.clear();
        objectType = null;
    }
}
