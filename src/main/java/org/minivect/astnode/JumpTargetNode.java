package org.minivect.astnode;

import org.minivect.astvisitor.Visitor;

import java.util.List;

/**
 * Places a label in the statement stream.
 */
public class JumpTargetNode extends AbstractNode {
    public final LabelNode label;

    public JumpTargetNode(LabelNode label) {
        this.label = label;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> children() {
        return childList(label);
    }
}
