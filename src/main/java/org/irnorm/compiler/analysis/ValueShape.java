package org.irnorm.compiler.analysis;

/**
 * Coarse shape of a value, as far as its uses or its origin reveal it.
 */
public enum ValueShape {
    /** Maps, structs, tuples, lists: things that get field or index access. */
    STRUCTURED,
    /** Numbers: things that take part in arithmetic or ordering. */
    SCALAR,
    /** Uses point both ways. */
    CONFLICT,
    /** Nothing known. */
    UNKNOWN;

    /**
     * Combines two observations of the same value.
     * @param other The other observation.
     * @return The combined shape.
     */
    public ValueShape join(ValueShape other) {
        if (this == UNKNOWN) {
            return other;
        }
        if (other == UNKNOWN || other == this) {
            return this;
        }
        return CONFLICT;
    }
}
