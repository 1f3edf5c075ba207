package org.minivect.astvisitor;

import org.minivect.astnode.*;

/**
 * Visitor over the closed set of node kinds.
 * <p>
 * There are no default methods on purpose: adding a node kind adds a method here, and
 * every visitor has to handle it before the tree compiles again. Visitors that only
 * care about a few kinds extend {@link TreeVisitor}, which recurses into children for
 * every kind it is not told about.
 *
 * @param <R> the result type of a visit; {@code Void} for visitors run for their side effects
 */
public interface Visitor<R> {
    R visit(FunctionNode node);

    R visit(FunctionArgumentNode node);

    R visit(StatementListNode node);

    R visit(ForNode node);

    R visit(ReturnNode node);

    R visit(BinopNode node);

    R visit(UnopNode node);

    R visit(TempNode node);

    R visit(AssignmentExprNode node);

    R visit(AssignmentNode node);

    R visit(CastNode node);

    R visit(DereferenceNode node);

    R visit(SingleIndexNode node);

    R visit(ArrayAttributeNode node);

    R visit(VariableNode node);

    R visit(JumpNode node);

    R visit(JumpTargetNode node);

    R visit(LabelNode node);

    R visit(ConstantNode node);
}
