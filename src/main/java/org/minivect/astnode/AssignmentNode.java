package org.minivect.astnode;

import org.minivect.astvisitor.Visitor;

import java.util.List;

/**
 * An assignment statement. The operand is normally an {@link AssignmentExprNode}.
 */
public class AssignmentNode extends AbstractNode {
    public final Node operand;

    public AssignmentNode(Node operand) {
        this.operand = operand;
    }

    public AssignmentNode(Node lhs, Node rhs) {
        this(new AssignmentExprNode(lhs, rhs));
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
