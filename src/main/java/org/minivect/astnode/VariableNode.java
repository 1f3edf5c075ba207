package org.minivect.astnode;

import org.minivect.astvisitor.Visitor;

import java.util.List;

public class VariableNode extends AbstractNode {
    public final String name;
    public final Type type;

    public VariableNode(String name, Type type) {
        this.name = name;
        this.type = type;
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
