package org.irnorm.compiler.api;

/**
 * An exception that is thrown when the normalization pipeline cannot produce a usable tree.
 * <p>
 * It is part of the public API and hides the internal exception types of the passes.
 */
public class NormalizationException extends Exception {

    /**
     * Constructs a new normalization exception with the specified detail message.
     * @param message The detail message.
     */
    public NormalizationException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new normalization exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public NormalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
