package org.minivect.core;

/**
 * Settings for a single code generation run.
 * <p>
 * The driver that builds these options (command line, build plugin) lives outside this library;
 * tests and embedders set the public fields directly.
 */
public class CompilerOptions implements Cloneable {
    public boolean debugEnabled = false;
    public String fileName = null;
    public String indent = Configuration.defaultIndent;
    public String manglePrefix = Configuration.defaultManglePrefix;
    public String typeTableResource = Configuration.defaultTypeTable;
    public boolean emitBanner = true;

    @Override
    public CompilerOptions clone() {
        try {
            // Use super.clone() to create a shallow copy
            return (CompilerOptions) super.clone();
        } catch (CloneNotSupportedException e) {
            // This shouldn't happen, since we're implementing Cloneable
            throw new AssertionError();
        }
    }

    @Override
    public String toString() {
        return "CompilerOptions{\n" +
                "    debugEnabled=" + debugEnabled + ",\n" +
                "    fileName=" + (fileName != null ? "'" + fileName + "'" : "null") + ",\n" +
                "    indent='" + indent + "',\n" +
                "    manglePrefix='" + manglePrefix + "',\n" +
                "    typeTableResource='" + typeTableResource + "',\n" +
                "    emitBanner=" + emitBanner + "\n" +
                "}";
    }
}
