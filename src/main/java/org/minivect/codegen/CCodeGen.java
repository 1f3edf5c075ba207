package org.minivect.codegen;

import org.minivect.astnode.*;
import org.minivect.core.CodegenException;

import java.util.HashSet;
import java.util.Set;

/**
 * CCodeGen lowers a typed tree to C source.
 * <p>
 * Statement kinds emit lines through the context's writer and return null; expression kinds
 * return their rendered C text. Each visit method delegates to the Emit* class for its kind.
 * One instance serves exactly one generation run.
 */
public class CCodeGen extends CodeGen<String> {

    // Temporaries declared in the function being lowered
    private Set<String> declaredTemps = new HashSet<>();

    public CCodeGen(EmitterContext ctx) {
        super(ctx);
    }

    /**
     * Renders a node that has to produce a value.
     *
     * @param node the expression node
     * @return the C expression
     * @throws CodegenException if the node is a statement kind
     */
    public String expression(Node node) {
        String value = visit(node);
        if (value == null) {
            throw new CodegenException(node, node.getClass().getSimpleName() + " does not produce a value");
        }
        return value;
    }

    /**
     * Records a temporary declaration for the current function.
     *
     * @param name the mangled temporary name
     * @return true if the name was not declared yet
     */
    boolean declareTemp(String name) {
        return declaredTemps.add(name);
    }

    /**
     * Starts an empty temporary set for a function.
     *
     * @return the set of the enclosing function, to be handed back to {@link #endFunction(Set)}
     */
    Set<String> startFunction() {
        Set<String> enclosing = declaredTemps;
        declaredTemps = new HashSet<>();
        return enclosing;
    }

    void endFunction(Set<String> enclosing) {
        declaredTemps = enclosing;
    }

    /**
     * Returns the external name assigned to a lowered function, or null if it was not lowered.
     */
    public String getMangledName(FunctionNode node) {
        return ctx.names.get(node);
    }

    public String getLabelName(LabelNode node) {
        return ctx.names.get(node);
    }

    @Override
    public String visit(FunctionNode node) {
        return EmitFunction.emitFunction(this, node);
    }

    @Override
    public String visit(FunctionArgumentNode node) {
        return EmitFunction.emitArgument(this, node);
    }

    @Override
    public String visit(StatementListNode node) {
        return visitChildren(node);
    }

    @Override
    public String visit(ForNode node) {
        return EmitLoop.emitFor(this, node);
    }

    @Override
    public String visit(ReturnNode node) {
        return EmitStatement.emitReturn(this, node);
    }

    @Override
    public String visit(BinopNode node) {
        return EmitExpression.emitBinop(this, node);
    }

    @Override
    public String visit(UnopNode node) {
        return EmitExpression.emitUnop(this, node);
    }

    @Override
    public String visit(TempNode node) {
        return EmitTemp.emitTemp(this, node);
    }

    @Override
    public String visit(AssignmentExprNode node) {
        return EmitExpression.emitAssignmentExpr(this, node);
    }

    @Override
    public String visit(AssignmentNode node) {
        return EmitStatement.emitAssignment(this, node);
    }

    @Override
    public String visit(CastNode node) {
        return EmitExpression.emitCast(this, node);
    }

    @Override
    public String visit(DereferenceNode node) {
        return EmitExpression.emitDereference(this, node);
    }

    @Override
    public String visit(SingleIndexNode node) {
        return EmitExpression.emitSingleIndex(this, node);
    }

    @Override
    public String visit(ArrayAttributeNode node) {
        return node.name;
    }

    @Override
    public String visit(VariableNode node) {
        return ctx.code.mangle(node.name);
    }

    @Override
    public String visit(JumpNode node) {
        return EmitLabel.emitJump(this, node);
    }

    @Override
    public String visit(JumpTargetNode node) {
        return EmitLabel.emitJumpTarget(this, node);
    }

    @Override
    public String visit(LabelNode node) {
        return EmitLabel.emitLabel(ctx, node);
    }

    @Override
    public String visit(ConstantNode node) {
        return EmitExpression.emitConstant(node);
    }
}
