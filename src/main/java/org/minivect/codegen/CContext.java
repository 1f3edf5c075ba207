package org.minivect.codegen;

import org.minivect.astnode.Node;
import org.minivect.astnode.PointerType;
import org.minivect.astnode.ScalarType;
import org.minivect.astnode.Type;
import org.minivect.astvisitor.ErrorDetectorVisitor;
import org.minivect.core.CodegenException;
import org.minivect.core.CompilerOptions;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * The semantic context for plain C output.
 * <p>
 * Types come from a {@link TypeTable}; error protection uses {@link GotoErrorHandler}s on a
 * per-function status flag; disposal releases the resource-owning temporaries of a subtree.
 * One instance serves one generation run.
 */
public class CContext implements SemanticContext {
    private final CompilerOptions options;
    private final GeneratedNames names;
    private final TypeTable types;
    private final Deque<GotoErrorHandler> handlers = new ArrayDeque<>();
    private final Set<CodeWriter> flagDeclared = Collections.newSetFromMap(new IdentityHashMap<>());

    public CContext(CompilerOptions options, GeneratedNames names, TypeTable types) {
        this.options = options;
        this.names = names;
        this.types = types;
    }

    public CContext(CompilerOptions options, GeneratedNames names) {
        this(options, names, TypeTable.load(options.typeTableResource));
    }

    @Override
    public String declareType(Type type) {
        if (type instanceof ScalarType scalar) {
            return types.lookup(scalar.name()).cName();
        }
        if (type instanceof PointerType pointer) {
            String base = declareType(pointer.base());
            return base.endsWith("*") ? base + "*" : base + " *";
        }
        throw new CodegenException("Cannot declare type " + type);
    }

    @Override
    public String initialValue(Type type) {
        TypeTable.Entry entry = typeEntry(type);
        return entry != null ? entry.init() : null;
    }

    /**
     * Returns the table entry of a scalar type, or null for pointers, which own nothing.
     */
    TypeTable.Entry typeEntry(Type type) {
        if (type instanceof ScalarType scalar) {
            return types.lookup(scalar.name());
        }
        return null;
    }

    @Override
    public boolean bodyMayError(Node node) {
        return ErrorDetectorVisitor.mayError(node);
    }

    @Override
    public ErrorHandler errorHandler(CodeWriter code) {
        CodeWriter declarationPoint = code.getDeclarationPoint();
        if (declarationPoint == null) {
            throw new CodegenException("Error protection requested outside of a function");
        }
        String prefix = code.getManglePrefix();
        String flag = prefix + "error_flag";
        if (flagDeclared.add(declarationPoint)) {
            declarationPoint.emitLine("int " + flag + " = 0;");
        }
        GotoErrorHandler handler = new GotoErrorHandler(this, prefix + "error_" + names.nextLabelIndex(),
                flag, handlers.peek());
        handlers.push(handler);
        return handler;
    }

    /**
     * Returns the innermost active handler, or null when no region is protected.
     */
    public GotoErrorHandler currentHandler() {
        return handlers.peek();
    }

    // Handlers are released in LIFO order by their cascade
    void release(GotoErrorHandler handler) {
        if (handlers.peek() != handler) {
            throw new CodegenException("Error handler " + handler.getLabel() + " cascaded out of order");
        }
        handlers.pop();
    }

    @Override
    public void generateDisposalCode(CodeWriter code, Node node) {
        if (node == null) {
            return;
        }
        EmitterContext ctx = new EmitterContext(options, code, this, names);
        new DisposalVisitor(ctx, this).visit(node);
    }
}
