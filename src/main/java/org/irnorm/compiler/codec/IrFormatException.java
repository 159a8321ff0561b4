package org.irnorm.compiler.codec;

/**
 * Thrown when a JSON document does not describe a well-formed IR tree.
 */
public class IrFormatException extends RuntimeException {

    public IrFormatException(String message) {
        super(message);
    }

    public IrFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
