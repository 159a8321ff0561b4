package org.irnorm.compiler.ir;

/**
 * A {@code field: value} pair of a struct literal or struct update.
 *
 * @param field The field name.
 * @param value The value expression.
 */
public record FieldValue(String field, IrNode value) {}
