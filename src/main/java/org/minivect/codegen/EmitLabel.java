package org.minivect.codegen;

import org.minivect.astnode.JumpNode;
import org.minivect.astnode.JumpTargetNode;
import org.minivect.astnode.LabelNode;

/**
 * EmitLabel handles labels, jumps and jump targets.
 * Jumps may be lowered before the target that places their label, so label names are
 * assigned on first reference and reused afterwards.
 */
public class EmitLabel {

    /**
     * Returns the C name of a label, assigning {@code <mangled name>_<counter>} on first use.
     * The counter is unique per run, so two labels with the same source name never clash.
     *
     * @param ctx  the current emitter context
     * @param node the label
     * @return the memoized C label name
     */
    static String emitLabel(EmitterContext ctx, LabelNode node) {
        return ctx.names.computeIfAbsent(node,
                label -> ctx.code.mangle(node.name) + "_" + ctx.names.nextLabelIndex());
    }

    static String emitJump(CCodeGen gen, JumpNode node) {
        gen.ctx.code.emitLine("goto " + gen.expression(node.label) + ";");
        return null;
    }

    static String emitJumpTarget(CCodeGen gen, JumpTargetNode node) {
        gen.ctx.code.emitLine(gen.expression(node.label) + ":");
        return null;
    }
}
