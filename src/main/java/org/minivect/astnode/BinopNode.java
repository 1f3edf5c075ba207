package org.minivect.astnode;

import org.minivect.astvisitor.Visitor;

import java.util.List;

/**
 * A binary operation. The operator is the C spelling ({@code +}, {@code <}, {@code &&}, ...).
 */
public class BinopNode extends AbstractNode {
    public final String operator;
    public final Node lhs;
    public final Node rhs;

    public BinopNode(String operator, Node lhs, Node rhs) {
        this.operator = operator;
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
