package org.minivect.core;

/**
 * Central configuration class for the minivect code generator.
 * Contains constants that control generator behavior and default resource locations.
 */
public final class Configuration {

    // Generator version information
    public static final String version = "1.0.0";

    // Classpath resource holding the default C type table
    public static final String defaultTypeTable = "minivect/ctypes.yaml";

    // Reserved prefix for escaped identifiers and generated labels
    public static final String defaultManglePrefix = "__mini_";

    public static final String defaultIndent = "    ";

    // Prevent instantiation
    private Configuration() {
    }

    /**
     * Returns the banner placed at the top of every generated translation unit.
     *
     * @return a C comment naming the generator and its version
     */
    public static String getBanner() {
        return "/* Generated by minivect-codegen " + version + " */";
    }
}
