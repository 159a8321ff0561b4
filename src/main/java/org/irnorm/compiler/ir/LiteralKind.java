package org.irnorm.compiler.ir;

/**
 * The kinds of literal values the IR can carry.
 */
public enum LiteralKind {
    INTEGER,
    FLOAT,
    STRING,
    ATOM,
    BOOLEAN,
    NIL;

    /**
     * @return {@code true} for INTEGER and FLOAT.
     */
    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }
}
