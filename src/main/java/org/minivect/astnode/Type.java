package org.minivect.astnode;

/**
 * A semantic type attached to typed nodes by the upstream type checker.
 * Rendering to C is the job of {@code SemanticContext.declareType}.
 */
public interface Type {
}
