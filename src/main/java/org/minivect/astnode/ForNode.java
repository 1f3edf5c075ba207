package org.minivect.astnode;

import org.minivect.astvisitor.Visitor;

import java.util.List;

/**
 * The ForNode class represents a node in the tree that holds a C "for" loop statement.
 * The parts of the statement are: "init", "condition", "step", and "body".
 *
 * <p>Any header clause may be null, which renders as an empty clause.</p>
 */
public class ForNode extends AbstractNode {
    /**
     * The initialization part of the for loop.
     */
    public final Node init;
    /**
     * The condition part of the for loop.
     */
    public final Node condition;
    /**
     * The step part of the for loop, executed after every iteration.
     */
    public final Node step;
    /**
     * The body of the for loop.
     */
    public final Node body;
    /**
     * A tiled loop shares the declaration and loop scope of its enclosing loop
     * instead of opening new levels.
     */
    public final boolean isTiled;

    /**
     * Constructs a new ForNode with the specified parts of the for loop.
     *
     * @param init      the initialization part of the for loop
     * @param condition the condition part of the for loop
     * @param step      the step part of the for loop
     * @param body      the body of the for loop
     * @param isTiled   true if the loop is one level of a tiled loop nest
     */
    public ForNode(Node init, Node condition, Node step, Node body, boolean isTiled) {
        this.init = init;
        this.condition = condition;
        this.step = step;
        this.body = body;
        this.isTiled = isTiled;
    }

    public ForNode(Node init, Node condition, Node step, Node body) {
        this(init, condition, step, body, false);
    }

    /**
     * Accepts a visitor that performs some operation on this node.
     *
     * @param visitor the visitor that will perform the operation on this node
     */
    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> children() {
        return childList(init, condition, step, body);
    }
}
