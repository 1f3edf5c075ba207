package org.minivect.codegen;

import org.junit.jupiter.api.Test;
import org.minivect.astnode.*;
import org.minivect.core.CompilerOptions;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CodeGenCleanupTest {

    private static class Recorder extends CodeGenCleanup {
        final List<Node> visited = new ArrayList<>();

        Recorder(EmitterContext ctx) {
            super(ctx);
        }

        @Override
        public Void visit(Node node) {
            visited.add(node);
            return super.visit(node);
        }
    }

    @Test
    public void testLoopBodyIsNeverVisited() {
        CompilerOptions options = new CompilerOptions();
        GeneratedNames names = new GeneratedNames();
        EmitterContext ctx = new EmitterContext(options, new CodeWriter(options), new CContext(options, names), names);
        Recorder recorder = new Recorder(ctx);

        VariableNode init = new VariableNode("i", ScalarType.INT);
        VariableNode condition = new VariableNode("c", ScalarType.INT);
        VariableNode inBody = new VariableNode("hidden", ScalarType.INT);
        Node loop = new ForNode(init, condition, null, new StatementListNode(List.of(new ReturnNode(inBody))));

        recorder.visit(loop);

        assertEquals(List.of(loop, init, condition), recorder.visited);
        assertEquals("", ctx.code.getValue());
    }
}
