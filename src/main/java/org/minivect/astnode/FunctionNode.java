package org.minivect.astnode;

import org.minivect.astvisitor.Visitor;

import java.util.List;

/**
 * The FunctionNode class represents a generated C function: its name, the specialization it was
 * instantiated for, its argument list and its body.
 * <p>
 * The external name is {@code name + specializationName} passed through the sink's mangling rule.
 */
public class FunctionNode extends AbstractNode {
    public final String name;

    /**
     * Suffix distinguishing specializations of the same function, empty when there is only one.
     */
    public final String specializationName;

    public final List<FunctionArgumentNode> arguments;

    public final Node body;

    public FunctionNode(String name, String specializationName, List<FunctionArgumentNode> arguments, Node body) {
        this.name = name;
        this.specializationName = specializationName == null ? "" : specializationName;
        this.arguments = List.copyOf(arguments);
        this.body = body;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> children() {
        return childList(arguments, body);
    }
}
