package org.minivect.codegen;

import org.minivect.astnode.AssignmentNode;
import org.minivect.astnode.ReturnNode;

/**
 * Lowers simple statements.
 */
public class EmitStatement {

    static String emitReturn(CCodeGen gen, ReturnNode node) {
        gen.ctx.code.emitLine("return " + gen.expression(node.operand) + ";");
        return null;
    }

    static String emitAssignment(CCodeGen gen, AssignmentNode node) {
        gen.ctx.code.emitLine(gen.expression(node.operand) + ";");
        return null;
    }
}
