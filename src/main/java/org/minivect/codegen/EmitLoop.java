package org.minivect.codegen;

import org.minivect.astnode.ForNode;
import org.minivect.astnode.Node;
import org.minivect.core.CodegenException;

import java.util.List;

/**
 * Lowers loops, including error protection of the body and disposal of the body's resources.
 */
public class EmitLoop {

    /**
     * Emits a C for loop.
     * <p>
     * Layout of the generated loop when the body may raise an error:
     * <pre>
     *   for (init; condition; step) {
     *       body
     *   error_label:           (catch point, reached by fall-through and on error)
     *       disposal of body   (insertion point, filled after the body)
     *       if (flag) cascade  (to the enclosing handler, or return -1)
     *   }
     * </pre>
     * Without error protection the disposal code directly follows the body.
     * A non-tiled loop opens a new declaration level and a new loop level for the body;
     * a tiled loop shares the levels of its enclosing loop.
     *
     * @param gen  the generator
     * @param node the loop
     * @return null, loops are statements
     */
    static String emitFor(CCodeGen gen, ForNode node) {
        EmitterContext ctx = gen.ctx;
        CodeWriter code = ctx.code;
        SemanticContext context = ctx.semanticContext;
        ctx.logDebug(node.isTiled ? "FOR start (tiled)" : "FOR start");

        ErrorHandler errorHandler = null;
        if (context.bodyMayError(node.body)) {
            errorHandler = context.errorHandler(code);
            ctx.logDebug("FOR body is error-protected");
        }

        List<String> header = gen.results(node.init, node.condition, node.step);
        code.emitLine("for (" + clause(node.init, header.get(0)) + "; "
                + clause(node.condition, header.get(1)) + "; "
                + clause(node.step, header.get(2)) + ") {");

        if (!node.isTiled) {
            code.pushDeclarationLevel(code.insertionPoint());
            code.pushLoopLevel(code.insertionPoint());
        }

        // The init clause is lowered again inside the loop scope
        gen.visitChild(node.init);
        gen.visit(node.body);

        CodeWriter disposalPoint;
        if (errorHandler != null) {
            errorHandler.catchHere(code);
            disposalPoint = code.insertionPoint();
            errorHandler.cascade(code);
        } else {
            disposalPoint = code;
        }

        context.generateDisposalCode(disposalPoint, node.body);

        if (!node.isTiled) {
            code.popDeclarationLevel();
            code.popLoopLevel();
        }

        code.emitLine("}");
        ctx.logDebug("FOR end");
        return null;
    }

    private static String clause(Node node, String rendered) {
        if (node == null) {
            return "";
        }
        if (rendered == null) {
            throw new CodegenException(node, node.getClass().getSimpleName() + " cannot be used as a loop header clause");
        }
        return rendered;
    }
}
