package org.minivect.codegen;

import org.minivect.astnode.Node;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Names generated during one run, keyed by node identity.
 * <p>
 * Nodes are never mutated by the generator; the mangled name of a function, the memoized name
 * of a label and the C name of every lowered temporary live here instead. The label counter
 * is shared by user labels and error labels of the run.
 */
public class GeneratedNames {
    private final Map<Node, String> names = new IdentityHashMap<>();
    private int labelCounter = 0;

    public String get(Node node) {
        return names.get(node);
    }

    public void put(Node node, String name) {
        names.put(node, name);
    }

    /**
     * Returns the name already assigned to the node, assigning one on first use.
     *
     * @param node      the node
     * @param generator creates the name on first use
     * @return the stable name
     */
    public String computeIfAbsent(Node node, Function<Node, String> generator) {
        String name = names.get(node);
        if (name == null) {
            name = generator.apply(node);
            names.put(node, name);
        }
        return name;
    }

    public int nextLabelIndex() {
        return labelCounter++;
    }

    public int getLabelCount() {
        return labelCounter;
    }
}
