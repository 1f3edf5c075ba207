package org.minivect.astnode;

import org.minivect.astvisitor.Visitor;

import java.util.List;
import java.util.Objects;

/**
 * The ConstantNode class represents a literal value. The value is kept as the object
 * produced upstream (Integer, Long, Double, Boolean, ...) and rendered by the generator.
 */
public class ConstantNode extends AbstractNode {
    public final Object value;

    public ConstantNode(Object value) {
        this.value = Objects.requireNonNull(value, "constant value");
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
