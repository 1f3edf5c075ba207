package org.minivect.astnode;

import org.minivect.astvisitor.Visitor;

import java.util.List;

/**
 * A prefix unary operation such as {@code -x} or {@code !x}.
 */
public class UnopNode extends AbstractNode {
    public final String operator;
    public final Node operand;

    public UnopNode(String operator, Node operand) {
        this.operator = operator;
        this.operand = operand;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> children() {
        return childList(operand);
    }
}
