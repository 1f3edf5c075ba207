package org.minivect.astnode;

import org.minivect.astvisitor.PrintVisitor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Abstract base class for tree nodes that includes a tokenIndex pointing
 * back to the upstream token list. This tokenIndex is used for providing better
 * error messages; it is -1 when the node was synthesized.
 * <p>
 * It also provides deep toString() formatting using PrintVisitor
 */
public abstract class AbstractNode implements Node {
    public int tokenIndex = -1;

    // Lazy initialization - only created when first annotation is set
    public Map<String, Object> annotations;

    @Override
    public int getIndex() {
        return tokenIndex;
    }

    @Override
    public void setIndex(int tokenIndex) {
        this.tokenIndex = tokenIndex;
    }

    /**
     * Collects the non-null children, flattening list fields.
     *
     * @param fields child nodes or lists of child nodes
     * @return the flattened children
     */
    protected static List<Node> childList(Object... fields) {
        List<Node> result = new ArrayList<>();
        for (Object field : fields) {
            if (field instanceof Node node) {
                result.add(node);
            } else if (field instanceof List<?> list) {
                for (Object element : list) {
                    if (element != null) {
                        result.add((Node) element);
                    }
                }
            }
        }
        return result;
    }

    /**
     * Returns a string representation of the syntax tree.
     *
     * @return a string representation of the syntax tree
     */
    @Override
    public String toString() {
        PrintVisitor printVisitor = new PrintVisitor();
        this.accept(printVisitor);
        return printVisitor.getResult();
    }

    public void setAnnotation(String key, Object value) {
        if (annotations == null) {
            annotations = new HashMap<>();
        }
        annotations.put(key, value);
    }

    public Object getAnnotation(String key) {
        return annotations == null ? null : annotations.get(key);
    }

    public boolean getBooleanAnnotation(String key) {
        Object value = getAnnotation(key);
        return value instanceof Boolean && (Boolean) value;
    }
}
