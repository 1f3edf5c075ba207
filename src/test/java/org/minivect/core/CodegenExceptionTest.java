package org.minivect.core;

import org.junit.jupiter.api.Test;
import org.minivect.astnode.ConstantNode;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class CodegenExceptionTest {

    @Test
    public void testMessageNamesNodeKind() {
        CodegenException e = new CodegenException(new ConstantNode(1), "No C literal");
        assertEquals("No C literal (ConstantNode)", e.getMessage());
    }

    @Test
    public void testMessageIncludesTokenIndex() {
        ConstantNode node = new ConstantNode(1);
        node.setIndex(42);

        assertEquals("No C literal (ConstantNode at token 42)", new CodegenException(node, "No C literal").getMessage());
    }

    @Test
    public void testPlainMessageAndCause() {
        IOException cause = new IOException("disk");
        CodegenException e = new CodegenException("Cannot read", cause);

        assertEquals("Cannot read", e.getMessage());
        assertSame(cause, e.getCause());
        assertEquals("bare", new CodegenException((org.minivect.astnode.Node) null, "bare").getMessage());
    }
}
