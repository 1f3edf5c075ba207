package org.minivect.codegen;

import org.minivect.astnode.FunctionArgumentNode;
import org.minivect.astnode.FunctionNode;
import org.minivect.astnode.VariableNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lowers function definitions.
 * <p>
 * Every function is emitted as {@code static int name(args)}; the int is the status of the
 * generated code, 0 on success and -1 once an error cascaded out of the outermost handler.
 */
public class EmitFunction {

    /**
     * Emits the prototype, the definition and the body of a function.
     * <p>
     * A declaration point is reserved right after the opening brace. All temporaries of the
     * function are declared there, however deeply they are nested.
     *
     * @param gen  the generator
     * @param node the function
     * @return null, functions are statements
     */
    static String emitFunction(CCodeGen gen, FunctionNode node) {
        EmitterContext ctx = gen.ctx;
        CodeWriter code = ctx.code;
        ctx.logDebug("FUNCTION start " + node.name + node.specializationName);

        String name = code.mangle(node.name + node.specializationName);
        ctx.names.put(node, name);

        List<String> args = gen.results(node.arguments);
        String proto = "static int " + name + "(" + (args.isEmpty() ? "void" : String.join(", ", args)) + ")";
        code.getProtoCode().emitLine(proto + ";");
        code.emitLine(proto + " {");

        CodeWriter enclosingDeclarationPoint = code.getDeclarationPoint();
        code.setDeclarationPoint(code.insertionPoint());
        Set<String> enclosingTemps = gen.startFunction();

        gen.visitChildren(node);

        code.emitLine("}");
        code.setDeclarationPoint(enclosingDeclarationPoint);
        gen.endFunction(enclosingTemps);
        ctx.logDebug("FUNCTION end " + name);
        return null;
    }

    /**
     * Renders one source argument as its C parameters, {@code "<type> <name>"} joined by {@code ", "}.
     */
    static String emitArgument(CCodeGen gen, FunctionArgumentNode node) {
        SemanticContext context = gen.ctx.semanticContext;
        List<String> parameters = new ArrayList<>(node.variables.size());
        for (VariableNode variable : node.variables) {
            parameters.add(context.declareType(variable.type) + " " + gen.visit(variable));
        }
        return String.join(", ", parameters);
    }
}
