package org.minivect.codegen;

import org.minivect.astvisitor.TreeVisitor;

/**
 * Base class of the visitors that write code: a {@link TreeVisitor} bound to the
 * emitter context of one run.
 *
 * @param <R> the result type of a visit
 */
public abstract class CodeGen<R> extends TreeVisitor<R> {
    /**
     * The emission context containing the current state and configuration
     */
    public final EmitterContext ctx;

    protected CodeGen(EmitterContext ctx) {
        this.ctx = ctx;
    }
}
