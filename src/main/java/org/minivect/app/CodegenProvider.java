package org.minivect.app;

import org.minivect.astnode.Node;
import org.minivect.codegen.CCodeGen;
import org.minivect.codegen.CContext;
import org.minivect.codegen.CodeWriter;
import org.minivect.codegen.EmitterContext;
import org.minivect.codegen.GeneratedNames;
import org.minivect.codegen.SemanticContext;
import org.minivect.core.CompilerOptions;
import org.minivect.core.Configuration;

/**
 * The CodegenProvider class lowers a typed tree to a C translation unit.
 * <p>
 * Every call is a separate run with its own writer, name table, semantic context and
 * generator, so runs never share mutable state.
 */
public class CodegenProvider {

    /**
     * Generates C source for a tree using the default C semantic context.
     *
     * @param root             the tree root, usually a function or a statement list of functions
     * @param compilerOptions  settings for this run
     * @return the translation unit: banner, prototypes, then definitions
     */
    public static String generate(Node root, CompilerOptions compilerOptions) {
        GeneratedNames names = new GeneratedNames();
        return generate(root, compilerOptions, new CContext(compilerOptions, names), names);
    }

    /**
     * Generates C source for a tree with a caller-supplied semantic context.
     *
     * @param root             the tree root
     * @param compilerOptions  settings for this run
     * @param semanticContext  type, error and disposal decisions
     * @param names            the name table the context shares with the generator
     * @return the translation unit
     */
    public static String generate(Node root, CompilerOptions compilerOptions,
                                  SemanticContext semanticContext, GeneratedNames names) {
        // Each run works on its own copy of the options
        compilerOptions = compilerOptions.clone();
        CodeWriter code = new CodeWriter(compilerOptions);
        EmitterContext ctx = new EmitterContext(compilerOptions, code, semanticContext, names);

        ctx.logDebug("Codegen start: " + (compilerOptions.fileName != null ? compilerOptions.fileName : "<tree>"));
        if (compilerOptions.debugEnabled) {
            ctx.logDebug("Tree:\n" + root);
        }

        new CCodeGen(ctx).visit(root);

        String result = code.getCode();
        if (compilerOptions.emitBanner) {
            result = Configuration.getBanner() + "\n\n" + result;
        }
        ctx.logDebug("Codegen end: " + names.getLabelCount() + " labels");
        return result;
    }
}
