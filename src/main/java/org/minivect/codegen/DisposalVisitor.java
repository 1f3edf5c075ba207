package org.minivect.codegen;

import org.minivect.astnode.TempNode;
import org.minivect.core.CodegenException;

import java.util.HashSet;
import java.util.Set;

/**
 * Emits the release of every resource-owning temporary in a subtree.
 * Loop bodies inside the subtree are skipped, they were disposed by their own loop.
 */
public class DisposalVisitor extends CodeGenCleanup {
    private final CContext context;
    private final Set<String> disposed = new HashSet<>();

    public DisposalVisitor(EmitterContext ctx, CContext context) {
        super(ctx);
        this.context = context;
    }

    @Override
    public Void visit(TempNode node) {
        String name = ctx.names.get(node);
        if (name == null) {
            throw new CodegenException(node, "Disposal requested for temporary '" + node.name + "' that was never lowered");
        }
        TypeTable.Entry entry = context.typeEntry(node.type);
        if (entry != null && entry.isDisposable() && disposed.add(name)) {
            ctx.code.emitLine(entry.dispose(name));
        }
        return null;
    }
}
