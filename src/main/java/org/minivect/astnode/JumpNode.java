package org.minivect.astnode;

import org.minivect.astvisitor.Visitor;

import java.util.List;

/**
 * An unconditional jump to a label. The label may be placed before or after the jump.
 */
public class JumpNode extends AbstractNode {
    public final LabelNode label;

    public JumpNode(LabelNode label) {
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
