package org.minivect.codegen;

import org.minivect.astnode.Node;
import org.minivect.astnode.Type;

/**
 * Type, error and resource knowledge the generator consults while lowering.
 */
public interface SemanticContext {

    /**
     * Renders a semantic type in C declaration form, e.g. {@code double} or {@code PyObject *}.
     */
    String declareType(Type type);

    /**
     * Returns the C value temporaries of this type are initialized with, or null to leave them
     * uninitialized.
     */
    String initialValue(Type type);

    /**
     * Static predicate: can executing this subtree raise an error at run time?
     */
    boolean bodyMayError(Node node);

    /**
     * Creates a handler protecting the code about to be emitted through {@code code}.
     */
    ErrorHandler errorHandler(CodeWriter code);

    /**
     * Emits, at {@code code}, the release of every resource acquired while executing {@code node}.
     */
    void generateDisposalCode(CodeWriter code, Node node);
}
