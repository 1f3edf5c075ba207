package org.minivect.codegen;

import org.minivect.astnode.TempNode;
import org.minivect.core.CodegenException;

/**
 * Lowers references to temporaries.
 */
public class EmitTemp {

    /**
     * Returns the C name of a temporary and declares it at the function's declaration point
     * the first time the name is seen in the current function. Types with an initial value in
     * the type table are declared with it.
     *
     * @param gen  the generator
     * @param node the temporary
     * @return the mangled name
     * @throws CodegenException if no function is being lowered
     */
    static String emitTemp(CCodeGen gen, TempNode node) {
        EmitterContext ctx = gen.ctx;
        String name = ctx.code.mangle(node.name);
        ctx.names.put(node, name);

        if (gen.declareTemp(name)) {
            CodeWriter declarationPoint = ctx.code.getDeclarationPoint();
            if (declarationPoint == null) {
                throw new CodegenException(node, "Temporary '" + node.name + "' used outside of a function");
            }
            String init = ctx.semanticContext.initialValue(node.type);
            declarationPoint.emitLine(ctx.semanticContext.declareType(node.type) + " " + name
                    + (init != null ? " = " + init : "") + ";");
        }
        return name;
    }
}
