package org.irnorm.compiler.diagnostics;

import org.irnorm.compiler.api.SourceInfo;

/**
 * Represents a single diagnostic message (error, warning, info)
 * reported while the pass pipeline runs.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param pass The name of the pass (or pipeline stage) that reported it.
 * @param message The diagnostic message.
 * @param source The host-language position of the node concerned.
 */
public record Diagnostic(
        Type type,
        String pass,
        String message,
        SourceInfo source
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents the serializer from producing valid output. */
        ERROR,
        /** A warning that does not stop the pipeline. */
        WARNING,
        /** An informational message, e.g. a repair that was skipped as ambiguous. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s (%s)", type, source, message, pass);
    }
}
