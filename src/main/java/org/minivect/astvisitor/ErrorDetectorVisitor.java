package org.minivect.astvisitor;

import org.minivect.astnode.AbstractNode;
import org.minivect.astnode.Node;

/**
 * Visitor that detects nodes the type checker marked as able to raise an error
 * at run time (annotation {@value #MAY_ERROR}).
 */
public class ErrorDetectorVisitor extends TreeVisitor<Void> {
    public static final String MAY_ERROR = "mayError";

    private boolean mayError = false;

    /**
     * Returns true if the subtree rooted at {@code node} contains a node that may raise an error.
     *
     * @param node the subtree root, may be null
     * @return true if an error-raising node was found
     */
    public static boolean mayError(Node node) {
        if (node == null) {
            return false;
        }
        ErrorDetectorVisitor detector = new ErrorDetectorVisitor();
        detector.visit(node);
        return detector.mayError;
    }

    @Override
    public Void visit(Node node) {
        if (mayError) {
            return null; // Early exit once found
        }
        if (node instanceof AbstractNode abstractNode && abstractNode.getBooleanAnnotation(MAY_ERROR)) {
            mayError = true;
            return null;
        }
        return super.visit(node);
    }
}
