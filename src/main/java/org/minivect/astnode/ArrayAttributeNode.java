package org.minivect.astnode;

import org.minivect.astvisitor.Visitor;

import java.util.List;

/**
 * An attribute of an array operand (its data pointer, shape or strides), already spelled
 * as a target-level expression by the upstream specializer. It is rendered verbatim.
 */
public class ArrayAttributeNode extends AbstractNode {
    public final String name;

    public ArrayAttributeNode(String name) {
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
