package org.minivect.astnode;

import org.minivect.astvisitor.Visitor;

import java.util.List;

/**
 * Indexing with a single subscript, {@code lhs[rhs]}.
 */
public class SingleIndexNode extends AbstractNode {
    public final Node lhs;
    public final Node rhs;

    public SingleIndexNode(Node lhs, Node rhs) {
        this.lhs = lhs;
        this.rhs = rhs;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> children() {
        return childList(lhs, rhs);
    }
}
