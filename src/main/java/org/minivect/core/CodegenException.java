package org.minivect.core;

import org.minivect.astnode.Node;

import java.io.Serial;

/**
 * CodegenException is the fault raised by the code generator.
 * <p>
 * Every generator-side failure is fatal for the current run: an unmodeled node reaching
 * the dispatcher, a broken sink or context contract, or an unusable configuration.
 * The message names the offending node kind and, when the upstream parser recorded one,
 * the token index of the node.
 */
public class CodegenException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    // Detailed error message that includes the node kind and position
    private final String errorMessage;

    /**
     * Constructs a new CodegenException for a failure that is not tied to a tree node.
     *
     * @param message the detail message describing the error
     */
    public CodegenException(String message) {
        super(message);
        this.errorMessage = message;
    }

    public CodegenException(String message, Throwable cause) {
        super(message, cause);
        this.errorMessage = message;
    }

    /**
     * Constructs a new CodegenException pointing at the node being lowered.
     *
     * @param node    the node that could not be lowered, may be null
     * @param message the detail message describing the error
     */
    public CodegenException(Node node, String message) {
        super(message);
        this.errorMessage = formatMessage(node, message);
    }

    private static String formatMessage(Node node, String message) {
        if (node == null) {
            return message;
        }
        String location = node.getClass().getSimpleName();
        if (node.getIndex() >= 0) {
            location += " at token " + node.getIndex();
        }
        return message + " (" + location + ")";
    }

    /**
     * Returns the detailed error message.
     *
     * @return the detailed error message
     */
    @Override
    public String getMessage() {
        return errorMessage;
    }
}
