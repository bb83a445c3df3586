package ai.gamedata.translator.markup;

/**
 * Receives every line of a file in order together with its classification.
 */
@FunctionalInterface
public interface LineVisitor {

    void visit(MarkupLine line, Classification classification);
}
