package org.minivect.astnode;

/**
 * A pointer to another type.
 */
public record PointerType(Type base) implements Type {
    @Override
    public String toString() {
        return base + "*";
    }
}
