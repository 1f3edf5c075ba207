package org.minivect.astnode;

import org.minivect.astvisitor.Visitor;

import java.util.List;

/**
 * A label shared by the jumps that target it and the jump target that places it.
 * The generated name is kept by the generator, keyed by node identity.
 */
public class LabelNode extends AbstractNode {
    public final String name;

    public LabelNode(String name) {
        this.name = name;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
