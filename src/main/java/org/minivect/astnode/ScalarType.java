package org.minivect.astnode;

/**
 * A named type, resolved against the C type table (for example {@code int}, {@code float64}, {@code object}).
 */
public record ScalarType(String name) implements Type {
    public static final ScalarType INT = new ScalarType("int");

    @Override
    public String toString() {
        return name;
    }
}
