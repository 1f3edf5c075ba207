package org.minivect.codegen;

/**
 * Error protection for a region of generated code.
 * <p>
 * The generator never catches anything itself; it asks the handler to emit the code that will
 * catch an error raised inside the protected region and pass it on to the enclosing region.
 */
public interface ErrorHandler {

    /**
     * Marks the point right after the protected region where control resumes on error.
     *
     * @param code the writer positioned after the region
     */
    void catchHere(CodeWriter code);

    /**
     * Emits the propagation of a caught error to the next enclosing protected region.
     * Called once, after the region's cleanup point has been reserved.
     *
     * @param code the writer positioned after the cleanup point
     */
    void cascade(CodeWriter code);
}
