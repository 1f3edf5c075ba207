package org.minivect.codegen;

import java.util.ArrayList;
import java.util.List;

/**
 * Output buffer that can be split into ordered fragments.
 * <p>
 * Text is appended to a pending stream. {@link #insertionPoint()} commits the pending text,
 * appends an empty child tree after it and returns that child; text written to the child later
 * still appears at the child's position in {@link #getValue()}, before everything written to
 * this tree afterwards.
 */
public class InsertionTree {
    private final List<InsertionTree> children = new ArrayList<>();
    private StringBuilder stream = new StringBuilder();

    public void write(String text) {
        stream.append(text);
    }

    /**
     * Returns a new tree anchored at the current end of this one.
     *
     * @return the child tree receiving deferred writes
     */
    public InsertionTree insertionPoint() {
        commit();
        InsertionTree other = new InsertionTree();
        children.add(other);
        return other;
    }

    // Moves the pending text into its own leaf so later children are ordered after it
    private void commit() {
        if (stream.length() > 0) {
            InsertionTree leaf = new InsertionTree();
            leaf.stream = stream;
            children.add(leaf);
            stream = new StringBuilder();
        }
    }

    public boolean isEmpty() {
        if (stream.length() > 0) {
            return false;
        }
        for (InsertionTree child : children) {
            if (!child.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Linearizes this tree: children in creation order, then the pending text.
     *
     * @return the document text
     */
    public String getValue() {
        StringBuilder out = new StringBuilder();
        appendTo(out);
        return out.toString();
    }

    private void appendTo(StringBuilder out) {
        for (InsertionTree child : children) {
            child.appendTo(out);
        }
        out.append(stream);
    }
}
