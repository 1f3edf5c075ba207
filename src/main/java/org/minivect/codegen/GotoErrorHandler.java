package org.minivect.codegen;

/**
 * Error handler for C built on a status flag and goto.
 * <p>
 * Failing code sets the function's error flag and jumps to this handler's label. The label
 * sits right after the protected region, so the normal path falls through it as well; the
 * cleanup code that follows therefore runs on both paths. The cascade then sends a pending
 * error on to the enclosing handler, or returns -1 from the function when there is none.
 */
public class GotoErrorHandler implements ErrorHandler {
    private final CContext context;
    private final String label;
    private final String flag;
    private final GotoErrorHandler enclosing;

    GotoErrorHandler(CContext context, String label, String flag, GotoErrorHandler enclosing) {
        this.context = context;
        this.label = label;
        this.flag = flag;
        this.enclosing = enclosing;
    }

    public String getLabel() {
        return label;
    }

    public String getFlag() {
        return flag;
    }

    public GotoErrorHandler getEnclosing() {
        return enclosing;
    }

    /**
     * Returns the statement generated code uses to raise an error in the protected region.
     */
    public String raise() {
        return "{ " + flag + " = 1; goto " + label + "; }";
    }

    @Override
    public void catchHere(CodeWriter code) {
        code.emitLine(label + ":");
    }

    @Override
    public void cascade(CodeWriter code) {
        context.release(this);
        if (enclosing != null) {
            code.emitLine("if (" + flag + ") goto " + enclosing.label + ";");
        } else {
            code.emitLine("if (" + flag + ") return -1;");
        }
    }
}
