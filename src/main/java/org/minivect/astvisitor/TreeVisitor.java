package org.minivect.astvisitor;

import org.minivect.astnode.*;
import org.minivect.core.CodegenException;

import java.util.ArrayList;
import java.util.List;

/**
 * Depth-first traversal of a node tree.
 * <p>
 * {@link #visit(Node)} dispatches on the node kind. Every kind-specific method defaults to
 * {@link #visitChildren(Node)}, a pure traversal that visits each child field in order and
 * produces no result; subclasses override the kinds they specialize.
 *
 * <p>Usage:</p>
 * <pre>
 *   List&lt;String&gt; header = visitor.results(node.init, node.condition, node.step);
 * </pre>
 *
 * @param <R> the result type of a visit
 */
public abstract class TreeVisitor<R> implements Visitor<R> {

    /**
     * Dispatches the node to the visit method for its kind.
     *
     * @param node the node to visit
     * @return the result of the kind-specific visit
     * @throws CodegenException if the node is null
     */
    public R visit(Node node) {
        if (node == null) {
            throw new CodegenException("Cannot dispatch a null node in " + getClass().getSimpleName());
        }
        return node.accept(this);
    }

    /**
     * Null-safe variant of {@link #visit(Node)}: an absent child yields null.
     */
    public R visitChild(Node node) {
        if (node == null) {
            return null;
        }
        return visit(node);
    }

    /**
     * Visits every element of a child list in order.
     *
     * @param nodes the child list
     * @return one result per element, in order
     */
    public List<R> visitChildList(List<? extends Node> nodes) {
        List<R> results = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            results.add(visitChild(node));
        }
        return results;
    }

    /**
     * Visits all children of a node for their side effects.
     *
     * @param node the parent node
     * @return always null
     */
    public R visitChildren(Node node) {
        for (Node child : node.children()) {
            visitChild(child);
        }
        return null;
    }

    /**
     * Visits single children and returns their results in order.
     * An absent child contributes a null entry so positions stay stable.
     *
     * @param nodes the children to render
     * @return the results, one per argument
     */
    public final List<R> results(Node... nodes) {
        List<R> results = new ArrayList<>(nodes.length);
        for (Node node : nodes) {
            results.add(visitChild(node));
        }
        return results;
    }

    /**
     * Visits several child lists and concatenates their results into one flat list.
     *
     * @param childLists the child lists, in output order
     * @return the flattened results
     */
    @SafeVarargs
    public final List<R> results(List<? extends Node>... childLists) {
        List<R> results = new ArrayList<>();
        for (List<? extends Node> childList : childLists) {
            results.addAll(visitChildList(childList));
        }
        return results;
    }

    @Override
    public R visit(FunctionNode node) {
        return visitChildren(node);
    }

    @Override
    public R visit(FunctionArgumentNode node) {
        return visitChildren(node);
    }

    @Override
    public R visit(StatementListNode node) {
        return visitChildren(node);
    }

    @Override
    public R visit(ForNode node) {
        return visitChildren(node);
    }

    @Override
    public R visit(ReturnNode node) {
        return visitChildren(node);
    }

    @Override
    public R visit(BinopNode node) {
        return visitChildren(node);
    }

    @Override
    public R visit(UnopNode node) {
        return visitChildren(node);
    }

    @Override
    public R visit(TempNode node) {
        return visitChildren(node);
    }

    @Override
    public R visit(AssignmentExprNode node) {
        return visitChildren(node);
    }

    @Override
    public R visit(AssignmentNode node) {
        return visitChildren(node);
    }

    @Override
    public R visit(CastNode node) {
        return visitChildren(node);
    }

    @Override
    public R visit(DereferenceNode node) {
        return visitChildren(node);
    }

    @Override
    public R visit(SingleIndexNode node) {
        return visitChildren(node);
    }

    @Override
    public R visit(ArrayAttributeNode node) {
        return visitChildren(node);
    }

    @Override
    public R visit(VariableNode node) {
        return visitChildren(node);
    }

    @Override
    public R visit(JumpNode node) {
        return visitChildren(node);
    }

    @Override
    public R visit(JumpTargetNode node) {
        return visitChildren(node);
    }

    @Override
    public R visit(LabelNode node) {
        return visitChildren(node);
    }

    @Override
    public R visit(ConstantNode node) {
        return visitChildren(node);
    }
}
