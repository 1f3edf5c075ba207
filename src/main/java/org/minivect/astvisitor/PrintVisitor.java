package org.minivect.astvisitor;

import org.minivect.astnode.*;

import java.util.Map;

/*
 *
 * Usage:
 *
 *   PrintVisitor printVisitor = new PrintVisitor();
 *   node.accept(printVisitor);
 *   return printVisitor.getResult();
 */
public class PrintVisitor implements Visitor<Void> {

    private final StringBuilder sb = new StringBuilder();
    private int indentLevel = 0;

    private void appendIndent() {
        sb.append("  ".repeat(Math.max(0, indentLevel)));
    }

    public String getResult() {
        return sb.toString();
    }

    private void printHeader(AbstractNode node, String text) {
        appendIndent();
        sb.append(text);
        if (node.tokenIndex >= 0) {
            sb.append("  pos:").append(node.tokenIndex);
        }
        sb.append("\n");
        printAnnotations(node);
    }

    private void printAnnotations(AbstractNode node) {
        if (node.annotations == null || node.annotations.isEmpty()) {
            return;
        }
        indentLevel++;
        for (Map.Entry<String, Object> entry : node.annotations.entrySet()) {
            appendIndent();
            sb.append("@").append(entry.getKey()).append(": ").append(entry.getValue()).append("\n");
        }
        indentLevel--;
    }

    // Prints "name:" followed by the child one level deeper, or "name: null"
    private void printChild(String name, Node child) {
        appendIndent();
        if (child == null) {
            sb.append(name).append(": null\n");
            return;
        }
        sb.append(name).append(":\n");
        indentLevel++;
        child.accept(this);
        indentLevel--;
    }

    @Override
    public Void visit(FunctionNode node) {
        printHeader(node, "FunctionNode: " + node.name + node.specializationName);
        indentLevel++;
        for (FunctionArgumentNode argument : node.arguments) {
            argument.accept(this);
        }
        printChild("Body", node.body);
        indentLevel--;
        return null;
    }

    @Override
    public Void visit(FunctionArgumentNode node) {
        printHeader(node, "FunctionArgumentNode:");
        indentLevel++;
        for (VariableNode variable : node.variables) {
            variable.accept(this);
        }
        indentLevel--;
        return null;
    }

    @Override
    public Void visit(StatementListNode node) {
        printHeader(node, "StatementListNode:");
        indentLevel++;
        for (Node statement : node.statements) {
            if (statement == null) {
                appendIndent();
                sb.append("null\n");
            } else {
                statement.accept(this);
            }
        }
        indentLevel--;
        return null;
    }

    @Override
    public Void visit(ForNode node) {
        printHeader(node, "ForNode:");
        indentLevel++;
        appendIndent();
        sb.append(node.isTiled ? "tiled\n" : "not tiled\n");
        printChild("Init", node.init);
        printChild("Condition", node.condition);
        printChild("Step", node.step);
        printChild("Body", node.body);
        indentLevel--;
        return null;
    }

    @Override
    public Void visit(ReturnNode node) {
        printHeader(node, "ReturnNode:");
        indentLevel++;
        printChild("Operand", node.operand);
        indentLevel--;
        return null;
    }

    @Override
    public Void visit(BinopNode node) {
        printHeader(node, "BinopNode: " + node.operator);
        indentLevel++;
        printChild("Lhs", node.lhs);
        printChild("Rhs", node.rhs);
        indentLevel--;
        return null;
    }

    @Override
    public Void visit(UnopNode node) {
        printHeader(node, "UnopNode: " + node.operator);
        indentLevel++;
        printChild("Operand", node.operand);
        indentLevel--;
        return null;
    }

    @Override
    public Void visit(TempNode node) {
        printHeader(node, "TempNode: " + node.name + " type:" + node.type);
        return null;
    }

    @Override
    public Void visit(AssignmentExprNode node) {
        printHeader(node, "AssignmentExprNode:");
        indentLevel++;
        printChild("Lhs", node.lhs);
        printChild("Rhs", node.rhs);
        indentLevel--;
        return null;
    }

    @Override
    public Void visit(AssignmentNode node) {
        printHeader(node, "AssignmentNode:");
        indentLevel++;
        printChild("Operand", node.operand);
        indentLevel--;
        return null;
    }

    @Override
    public Void visit(CastNode node) {
        printHeader(node, "CastNode: " + node.type);
        indentLevel++;
        printChild("Operand", node.operand);
        indentLevel--;
        return null;
    }

    @Override
    public Void visit(DereferenceNode node) {
        printHeader(node, "DereferenceNode:");
        indentLevel++;
        printChild("Operand", node.operand);
        indentLevel--;
        return null;
    }

    @Override
    public Void visit(SingleIndexNode node) {
        printHeader(node, "SingleIndexNode:");
        indentLevel++;
        printChild("Lhs", node.lhs);
        printChild("Rhs", node.rhs);
        indentLevel--;
        return null;
    }

    @Override
    public Void visit(ArrayAttributeNode node) {
        printHeader(node, "ArrayAttributeNode: " + node.name);
        return null;
    }

    @Override
    public Void visit(VariableNode node) {
        printHeader(node, "VariableNode: " + node.name + " type:" + node.type);
        return null;
    }

    @Override
    public Void visit(JumpNode node) {
        printHeader(node, "JumpNode: " + node.label.name);
        return null;
    }

    @Override
    public Void visit(JumpTargetNode node) {
        printHeader(node, "JumpTargetNode: " + node.label.name);
        return null;
    }

    @Override
    public Void visit(LabelNode node) {
        printHeader(node, "LabelNode: " + node.name);
        return null;
    }

    @Override
    public Void visit(ConstantNode node) {
        printHeader(node, "ConstantNode: " + node.value);
        return null;
    }
}
