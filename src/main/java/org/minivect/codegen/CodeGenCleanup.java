package org.minivect.codegen;

import org.minivect.astnode.ForNode;

/**
 * Walks a subtree after its loops have been lowered, without emitting anything itself.
 * <p>
 * The body of a loop has already been disposed of by the loop, so only the header clauses
 * are revisited; they run outside the body's disposal scope. Subclasses hook the kinds that
 * need cleanup.
 */
public class CodeGenCleanup extends CodeGen<Void> {

    public CodeGenCleanup(EmitterContext ctx) {
        super(ctx);
    }

    @Override
    public Void visit(ForNode node) {
        visitChild(node.init);
        visitChild(node.condition);
        visitChild(node.step);
        return null;
    }
}
