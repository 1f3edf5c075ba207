package org.minivect.app;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.minivect.astnode.*;
import org.minivect.core.CodegenException;
import org.minivect.core.CompilerOptions;
import org.minivect.core.Configuration;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CodegenProviderTest {
    private PrintStream originalOut;
    private ByteArrayOutputStream outputStream;
    private CompilerOptions options;

    @BeforeEach
    void setUp() {
        originalOut = System.out;
        outputStream = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outputStream));
        options = new CompilerOptions();
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    private static Node program() {
        VariableNode x = new VariableNode("x", ScalarType.INT);
        VariableNode y = new VariableNode("y", new ScalarType("float64"));
        FunctionNode first = new FunctionNode("first", null, List.of(new FunctionArgumentNode(x)),
                new StatementListNode(List.of(new ReturnNode(x))));
        FunctionNode second = new FunctionNode("second", "_f8", List.of(new FunctionArgumentNode(List.of(x, y))),
                new StatementListNode(List.of(new ReturnNode(new ConstantNode(0)))));
        return new StatementListNode(List.of(first, second));
    }

    @Test
    public void testTranslationUnit() {
        String result = CodegenProvider.generate(program(), options);

        assertEquals(Configuration.getBanner() + "\n\n"
                + "static int first(int x);\n"
                + "static int second_f8(int x, double y);\n"
                + "\n"
                + "static int first(int x) {\n"
                + "    return x;\n"
                + "}\n"
                + "static int second_f8(int x, double y) {\n"
                + "    return 0;\n"
                + "}\n", result);
        assertEquals("", outputStream.toString());
    }

    @Test
    public void testWithoutBanner() {
        options.emitBanner = false;

        String result = CodegenProvider.generate(program(), options);

        assertTrue(result.startsWith("static int first(int x);\n"));
    }

    @Test
    public void testRunsAreIndependent() {
        Node root = program();
        LabelNode done = new LabelNode("done");
        Node withLabel = new FunctionNode("g", null, List.of(),
                new StatementListNode(List.of(new JumpNode(done), new JumpTargetNode(done))));

        assertEquals(CodegenProvider.generate(root, options), CodegenProvider.generate(root, options));
        String once = CodegenProvider.generate(withLabel, options);
        assertTrue(once.contains("goto done_0;"));
        assertEquals(once, CodegenProvider.generate(withLabel, options));
    }

    @Test
    public void testDebugOutput() {
        options.debugEnabled = true;
        options.fileName = "kernels.mv";

        CodegenProvider.generate(program(), options);

        String debug = outputStream.toString();
        assertTrue(debug.contains("Codegen start: kernels.mv"));
        assertTrue(debug.contains("FunctionNode: first"));
        assertTrue(debug.contains("FUNCTION end second_f8"));
    }

    @Test
    public void testUnknownTypeTable() {
        options.typeTableResource = "minivect/nowhere.yaml";

        assertThrows(CodegenException.class, () -> CodegenProvider.generate(program(), options));
    }
}
