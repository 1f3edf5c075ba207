package org.minivect.codegen;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.minivect.astnode.*;
import org.minivect.core.CodegenException;
import org.minivect.core.CompilerOptions;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CContextTest {

    private static final ScalarType OBJECT = new ScalarType("object");

    private CompilerOptions options;
    private GeneratedNames names;
    private CContext context;
    private CodeWriter code;

    @BeforeEach
    void setUp() {
        options = new CompilerOptions();
        names = new GeneratedNames();
        context = new CContext(options, names);
        code = new CodeWriter(options);
    }

    @Test
    public void testDeclareType() {
        assertEquals("double", context.declareType(new ScalarType("float64")));
        assertEquals("double *", context.declareType(new PointerType(new ScalarType("float64"))));
        assertEquals("double **", context.declareType(new PointerType(new PointerType(new ScalarType("float64")))));
        assertEquals("PyObject **", context.declareType(new PointerType(OBJECT)));
        assertThrows(CodegenException.class, () -> context.declareType(new ScalarType("quaternion")));
    }

    @Test
    public void testErrorHandlerNeedsAFunction() {
        assertThrows(CodegenException.class, () -> context.errorHandler(code));
    }

    @Test
    public void testNestedHandlersCascadeOutward() {
        CodeWriter declarations = code.insertionPoint();
        code.setDeclarationPoint(declarations);

        GotoErrorHandler outer = (GotoErrorHandler) context.errorHandler(code);
        GotoErrorHandler inner = (GotoErrorHandler) context.errorHandler(code);
        assertSame(outer, inner.getEnclosing());
        assertSame(inner, context.currentHandler());
        assertEquals("__mini_error_flag", inner.getFlag());
        assertEquals("{ __mini_error_flag = 1; goto " + inner.getLabel() + "; }", inner.raise());

        inner.catchHere(code);
        inner.cascade(code);
        outer.catchHere(code);
        outer.cascade(code);

        assertNull(context.currentHandler());
        assertEquals("int __mini_error_flag = 0;\n"
                + "__mini_error_1:\n"
                + "if (__mini_error_flag) goto __mini_error_0;\n"
                + "__mini_error_0:\n"
                + "if (__mini_error_flag) return -1;\n", code.getValue());
    }

    @Test
    public void testCascadeOutOfOrder() {
        code.setDeclarationPoint(code.insertionPoint());
        ErrorHandler outer = context.errorHandler(code);
        context.errorHandler(code);

        assertThrows(CodegenException.class, () -> outer.cascade(code));
    }

    @Test
    public void testDisposalOfUnloweredTemporary() {
        Node body = new StatementListNode(List.of(
                new AssignmentNode(new TempNode("t", OBJECT), new VariableNode("src", OBJECT))));

        CodegenException e = assertThrows(CodegenException.class, () -> context.generateDisposalCode(code, body));
        assertTrue(e.getMessage().contains("'t'"));
    }

    @Test
    public void testDisposalReleasesOwningTemporariesOnce() {
        TempNode first = new TempNode("t", OBJECT);
        TempNode second = new TempNode("t", OBJECT);
        TempNode counter = new TempNode("n", ScalarType.INT);
        names.put(first, "t");
        names.put(second, "t");
        names.put(counter, "n");
        Node body = new StatementListNode(List.of(
                new AssignmentNode(first, new VariableNode("src", OBJECT)),
                new AssignmentNode(counter, new BinopNode("+", counter, new ConstantNode(1))),
                new ReturnNode(second)));

        context.generateDisposalCode(code, body);

        assertEquals("Py_CLEAR(t);\n", code.getValue());
    }

    @Test
    public void testBodyMayError() {
        ConstantNode failing = new ConstantNode(1);
        failing.setAnnotation("mayError", true);

        assertTrue(context.bodyMayError(new ReturnNode(failing)));
        assertFalse(context.bodyMayError(new ReturnNode(new ConstantNode(1))));
    }
}
