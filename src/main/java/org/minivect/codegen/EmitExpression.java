package org.minivect.codegen;

import org.minivect.astnode.*;
import org.minivect.core.CodegenException;

/**
 * Renders expressions. Every compound form is fully parenthesized, so the output never
 * depends on C operator precedence.
 */
public class EmitExpression {

    static String emitBinop(CCodeGen gen, BinopNode node) {
        return "(" + gen.expression(node.lhs) + " " + node.operator + " " + gen.expression(node.rhs) + ")";
    }

    static String emitUnop(CCodeGen gen, UnopNode node) {
        return "(" + node.operator + gen.expression(node.operand) + ")";
    }

    static String emitCast(CCodeGen gen, CastNode node) {
        return "((" + gen.ctx.semanticContext.declareType(node.type) + ") " + gen.expression(node.operand) + ")";
    }

    static String emitDereference(CCodeGen gen, DereferenceNode node) {
        return "(*" + gen.expression(node.operand) + ")";
    }

    static String emitSingleIndex(CCodeGen gen, SingleIndexNode node) {
        return "(" + gen.expression(node.lhs) + "[" + gen.expression(node.rhs) + "])";
    }

    /**
     * Renders {@code lhs = rhs} without a terminating semicolon, so it can be nested
     * (for instance in a loop header).
     */
    static String emitAssignmentExpr(CCodeGen gen, AssignmentExprNode node) {
        return gen.expression(node.lhs) + " = " + gen.expression(node.rhs);
    }

    /**
     * Renders a literal. Booleans become {@code 1} and {@code 0}; non-finite floating point
     * values have no C literal and are rejected.
     */
    static String emitConstant(ConstantNode node) {
        Object value = node.value;
        if (value instanceof Boolean b) {
            return b ? "1" : "0";
        }
        if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
            throw new CodegenException(node, "No C literal for " + d);
        }
        if (value instanceof Float f && (f.isNaN() || f.isInfinite())) {
            throw new CodegenException(node, "No C literal for " + f);
        }
        return String.valueOf(value);
    }
}
