package org.irnorm.compiler.diagnostics;

import org.irnorm.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur while normalizing a unit.
 * <p>
 * This decouples reporting from the passes: a pass reports and carries on, the caller decides
 * what to do with the collected messages.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param pass    The reporting pass.
     * @param message The error message.
     * @param source  The position of the offending node.
     */
    public void reportError(String pass, String message, SourceInfo source) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, pass, message, source));
    }

    /**
     * Reports a warning.
     *
     * @param pass    The reporting pass.
     * @param message The warning message.
     * @param source  The position of the offending node.
     */
    public void reportWarning(String pass, String message, SourceInfo source) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, pass, message, source));
    }

    /**
     * Reports an informational message, typically a repair skipped as ambiguous.
     *
     * @param pass    The reporting pass.
     * @param message The message.
     * @param source  The position of the node concerned.
     */
    public void reportInfo(String pass, String message, SourceInfo source) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.INFO, pass, message, source));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
