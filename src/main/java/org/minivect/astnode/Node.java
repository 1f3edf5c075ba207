package org.minivect.astnode;

import org.minivect.astvisitor.Visitor;

import java.util.List;

/**
 * A node of the typed expression/statement tree consumed by the code generator.
 * <p>
 * The set of node kinds is closed by {@link Visitor}: a new kind needs a new visit method,
 * and every visitor must implement it before the project compiles again.
 */
public interface Node {

    /**
     * Dispatches to the visit method for this node kind.
     *
     * @param visitor the visitor
     * @param <R>     the visitor's result type
     * @return the visitor's result for this node
     */
    <R> R accept(Visitor<R> visitor);

    /**
     * Returns the child fields of this node in declaration order.
     * Absent (null) children are omitted and list-valued fields are flattened.
     *
     * @return the children, never null
     */
    List<Node> children();

    int getIndex();

    void setIndex(int tokenIndex);
}
