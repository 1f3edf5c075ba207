package org.minivect.codegen;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.minivect.core.CodegenException;
import org.minivect.core.CompilerOptions;

import static org.junit.jupiter.api.Assertions.*;

public class CodeWriterTest {

    private CodeWriter code;

    @BeforeEach
    void setUp() {
        code = new CodeWriter(new CompilerOptions());
    }

    @Test
    public void testInsertionPointPreservesDocumentOrder() {
        code.emitLine("a;");
        CodeWriter point = code.insertionPoint();
        code.emitLine("c;");
        point.emitLine("b;");

        assertEquals("a;\nb;\nc;\n", code.getValue());
    }

    @Test
    public void testEarlierCursorsPrecedeLaterOnes() {
        CodeWriter first = code.insertionPoint();
        CodeWriter second = code.insertionPoint();

        second.emitLine("second;");
        first.emitLine("first;");

        assertEquals("first;\nsecond;\n", code.getValue());
    }

    @Test
    public void testIndentationFollowsBraces() {
        code.emitLine("void f(void) {");
        code.emitLine("x = 1;");
        code.emitLine("for (;;) {");
        code.emitLine("y = 2;");
        code.emitLine("}");
        code.emitLine("}");

        assertEquals("void f(void) {\n    x = 1;\n    for (;;) {\n        y = 2;\n    }\n}\n", code.getValue());
    }

    @Test
    public void testInsertionPointInheritsIndentation() {
        code.emitLine("{");
        CodeWriter declarations = code.insertionPoint();
        code.emitLine("}");
        declarations.emitLine("int t;");

        assertEquals("{\n    int t;\n}\n", code.getValue());
    }

    @Test
    public void testCustomIndentUnit() {
        CompilerOptions options = new CompilerOptions();
        options.indent = "\t";
        CodeWriter tabbed = new CodeWriter(options);
        tabbed.emitLine("{");
        tabbed.emitLine("x;");
        tabbed.emitLine("}");

        assertEquals("{\n\tx;\n}\n", tabbed.getValue());
    }

    @Test
    public void testPrototypesPrecedeBody() {
        code.emitLine("static int f(void) {");
        code.emitLine("}");
        code.getProtoCode().emitLine("static int f(void);");

        assertEquals("static int f(void);\n\nstatic int f(void) {\n}\n", code.getCode());
    }

    @Test
    public void testSharedStateAcrossInsertionPoints() {
        CodeWriter point = code.insertionPoint();
        code.setDeclarationPoint(point);
        code.pushDeclarationLevel(point);
        code.pushLoopLevel(point);

        assertSame(point, point.getDeclarationPoint());
        assertSame(code.getProtoCode(), point.getProtoCode());
        assertEquals(1, point.declarationDepth());
        assertEquals(1, point.loopDepth());
        assertSame(point, point.currentDeclarationLevel());
        assertSame(point, point.currentLoopLevel());
    }

    @Test
    public void testStackUnderflowIsAContractViolation() {
        assertThrows(CodegenException.class, () -> code.popDeclarationLevel());
        assertThrows(CodegenException.class, () -> code.popLoopLevel());
        assertNull(code.currentDeclarationLevel());
    }

    @Test
    public void testMangleUsesConfiguredPrefix() {
        CompilerOptions options = new CompilerOptions();
        options.manglePrefix = "__gen_";
        CodeWriter custom = new CodeWriter(options);

        assertEquals("__gen_int", custom.mangle("int"));
        assertEquals("count", custom.mangle("count"));
    }
}
