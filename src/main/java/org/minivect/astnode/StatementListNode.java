package org.minivect.astnode;

import org.minivect.astvisitor.Visitor;

import java.util.List;

public class StatementListNode extends AbstractNode {
    public final List<Node> statements;

    public StatementListNode(List<Node> statements) {
        this.statements = List.copyOf(statements);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> children() {
        return childList(statements);
    }
}
