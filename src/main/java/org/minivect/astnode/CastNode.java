package org.minivect.astnode;

import org.minivect.astvisitor.Visitor;

import java.util.List;

public class CastNode extends AbstractNode {
    public final Type type;
    public final Node operand;

    public CastNode(Type type, Node operand) {
        this.type = type;
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
