package org.minivect.codegen;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class InsertionTreeTest {

    @Test
    public void testLateWritesLandAtTheirInsertionPoint() {
        InsertionTree tree = new InsertionTree();
        tree.write("a");
        InsertionTree first = tree.insertionPoint();
        tree.write("d");
        InsertionTree second = tree.insertionPoint();
        tree.write("f");

        second.write("e");
        first.write("b");
        first.insertionPoint().write("c");

        assertEquals("abcdef", tree.getValue());
    }

    @Test
    public void testIsEmpty() {
        InsertionTree tree = new InsertionTree();
        InsertionTree child = tree.insertionPoint();
        assertTrue(tree.isEmpty());

        child.write("x");
        assertFalse(tree.isEmpty());
    }
}
