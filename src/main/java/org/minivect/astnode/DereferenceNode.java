package org.minivect.astnode;

import org.minivect.astvisitor.Visitor;

import java.util.List;

public class DereferenceNode extends AbstractNode {
    public final Node operand;

    public DereferenceNode(Node operand) {
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
