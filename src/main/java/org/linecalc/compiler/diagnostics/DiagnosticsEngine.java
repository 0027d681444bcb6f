package org.linecalc.compiler.diagnostics;

import org.linecalc.api.ErrorKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the errors of one session in the order they occur.
 * <p>
 * This decouples error reporting from the line processing logic.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param kind       The kind of fault.
     * @param message    The error message, without line prefix.
     * @param lineNumber The 1-based line of the error.
     */
    public void reportError(ErrorKind kind, String message, int lineNumber) {
        diagnostics.add(new Diagnostic(kind, message, lineNumber));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
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
     * @return One "Line n: message" entry per line.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
