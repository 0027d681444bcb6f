package org.linecalc.compiler.diagnostics;

import org.linecalc.api.ErrorKind;
import org.linecalc.compiler.internal.i18n.Messages;

/**
 * A single line-scoped error recorded during a session.
 *
 * @param kind The kind of fault.
 * @param message The message without the line prefix.
 * @param lineNumber The 1-based input line the fault occurred on.
 */
public record Diagnostic(
        ErrorKind kind,
        String message,
        int lineNumber
) {
    @Override
    public String toString() {
        return Messages.get("diagnostic.line", lineNumber, message);
    }
}
