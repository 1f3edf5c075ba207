package org.minivect.codegen;

import org.minivect.core.CompilerOptions;

/**
 * The EmitterContext class holds the state of one generation run that the lowering
 * helpers need: options, the writer being emitted to, the semantic context and the
 * generated-name table.
 */
public class EmitterContext {

    /**
     * Settings for this run.
     */
    public final CompilerOptions compilerOptions;
    /**
     * The writer receiving statements at the current position.
     */
    public final CodeWriter code;
    /**
     * Type, error and disposal decisions.
     */
    public final SemanticContext semanticContext;
    /**
     * Names assigned to nodes during this run.
     */
    public final GeneratedNames names;

    public EmitterContext(CompilerOptions compilerOptions, CodeWriter code,
                          SemanticContext semanticContext, GeneratedNames names) {
        this.compilerOptions = compilerOptions;
        this.code = code;
        this.semanticContext = semanticContext;
        this.names = names;
    }

    public void logDebug(String message) {
        if (this.compilerOptions.debugEnabled) {
            System.out.println(message);
        }
    }

    @Override
    public String toString() {
        return "EmitterContext{\n" +
                "    semanticContext=" + (semanticContext != null ? semanticContext.getClass().getSimpleName() : "null") + ",\n" +
                "    labels=" + names.getLabelCount() + ",\n" +
                "    compilerOptions=" + compilerOptions + "\n" +
                "}";
    }
}
