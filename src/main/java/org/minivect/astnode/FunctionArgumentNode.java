package org.minivect.astnode;

import org.minivect.astvisitor.Visitor;

import java.util.List;

/**
 * One source-level argument of a function. An argument may expand to several C parameters
 * (for example a data pointer and its strides), one per variable.
 */
public class FunctionArgumentNode extends AbstractNode {
    public final List<VariableNode> variables;

    public FunctionArgumentNode(List<VariableNode> variables) {
        this.variables = List.copyOf(variables);
    }

    public FunctionArgumentNode(VariableNode variable) {
        this(List.of(variable));
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> children() {
        return childList(variables);
    }
}
