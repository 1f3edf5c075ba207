package org.minivect.codegen;

import org.minivect.core.CodegenException;
import org.minivect.core.CompilerOptions;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Line-oriented C output with insertion points.
 * <p>
 * A root writer is created per generation run. {@link #insertionPoint()} returns a writer
 * anchored at the current position: whatever is written to it later appears there in the
 * final document, before anything this writer emits afterwards. All writers derived from one
 * root share the prototype stream, the declaration and loop level stacks, the current
 * declaration point and the name mangler.
 *
 * <p>Indentation is tracked per writer: a line starting with {@code }} dedents, a line ending
 * with {@code {} indents the lines after it. An insertion point starts at the level of the
 * writer it was taken from.</p>
 */
public class CodeWriter {

    /**
     * State shared by a root writer and every insertion point taken from it.
     */
    private static final class Globals {
        final NameMangler mangler;
        final String indent;
        final Deque<CodeWriter> declarationLevels = new ArrayDeque<>();
        final Deque<CodeWriter> loopLevels = new ArrayDeque<>();
        InsertionTree mainBuffer;
        CodeWriter protoCode;
        CodeWriter declarationPoint;

        Globals(CompilerOptions options) {
            this.mangler = new NameMangler(options.manglePrefix);
            this.indent = options.indent;
        }
    }

    private final Globals globals;
    private final InsertionTree buffer;
    private int level;

    /**
     * Creates the root writer of a generation run.
     *
     * @param options supplies the indent unit and the mangling prefix
     */
    public CodeWriter(CompilerOptions options) {
        this.globals = new Globals(options);
        this.buffer = new InsertionTree();
        this.level = 0;
        globals.mainBuffer = buffer;
        globals.protoCode = new CodeWriter(globals, new InsertionTree(), 0);
    }

    private CodeWriter(Globals globals, InsertionTree buffer, int level) {
        this.globals = globals;
        this.buffer = buffer;
        this.level = level;
    }

    public String mangle(String name) {
        return globals.mangler.mangle(name);
    }

    public String getManglePrefix() {
        return globals.mangler.getPrefix();
    }

    /**
     * Appends one line at this writer's position.
     *
     * @param line the line, without trailing newline
     */
    public void emitLine(String line) {
        if (line.startsWith("}")) {
            level = Math.max(0, level - 1);
        }
        if (!line.isEmpty()) {
            buffer.write(globals.indent.repeat(level));
        }
        buffer.write(line);
        buffer.write("\n");
        if (line.endsWith("{")) {
            level++;
        }
    }

    /**
     * Returns a writer anchored at the current position of this one.
     *
     * @return the new insertion point
     */
    public CodeWriter insertionPoint() {
        return new CodeWriter(globals, buffer.insertionPoint(), level);
    }

    /**
     * Returns the stream of forward declarations, placed before the main body by {@link #getCode()}.
     */
    public CodeWriter getProtoCode() {
        return globals.protoCode;
    }

    public CodeWriter getDeclarationPoint() {
        return globals.declarationPoint;
    }

    public void setDeclarationPoint(CodeWriter declarationPoint) {
        globals.declarationPoint = declarationPoint;
    }

    public void pushDeclarationLevel(CodeWriter insertionPoint) {
        globals.declarationLevels.push(insertionPoint);
    }

    public CodeWriter popDeclarationLevel() {
        if (globals.declarationLevels.isEmpty()) {
            throw new CodegenException("Declaration level stack underflow");
        }
        return globals.declarationLevels.pop();
    }

    /**
     * Returns the innermost declaration level, or null outside any loop scope.
     */
    public CodeWriter currentDeclarationLevel() {
        return globals.declarationLevels.peek();
    }

    public int declarationDepth() {
        return globals.declarationLevels.size();
    }

    public void pushLoopLevel(CodeWriter insertionPoint) {
        globals.loopLevels.push(insertionPoint);
    }

    public CodeWriter popLoopLevel() {
        if (globals.loopLevels.isEmpty()) {
            throw new CodegenException("Loop level stack underflow");
        }
        return globals.loopLevels.pop();
    }

    public CodeWriter currentLoopLevel() {
        return globals.loopLevels.peek();
    }

    public int loopDepth() {
        return globals.loopLevels.size();
    }

    /**
     * Returns the text written through this writer and the insertion points taken from it.
     */
    public String getValue() {
        return buffer.getValue();
    }

    /**
     * Returns the whole translation unit: prototypes, a blank line, then the main body.
     */
    public String getCode() {
        String prototypes = globals.protoCode.getValue();
        String body = globals.mainBuffer.getValue();
        if (prototypes.isEmpty()) {
            return body;
        }
        return prototypes + "\n" + body;
    }
}
