package org.minivect.astnode;

import org.minivect.astvisitor.Visitor;

import java.util.List;

/**
 * A compiler temporary. Temporaries are declared once per function, at the top of the
 * function body, no matter how deeply the first reference is nested.
 */
public class TempNode extends AbstractNode {
    public final String name;
    public final Type type;

    public TempNode(String name, Type type) {
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
