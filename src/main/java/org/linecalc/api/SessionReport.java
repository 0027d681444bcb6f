package org.linecalc.api;

import org.linecalc.compiler.diagnostics.Diagnostic;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one session produced, ready for a shell to render.
 *
 * @param outcomes One outcome per non-blank line, in input order.
 * @param usedVariables The variables bound by assignment, in order of first assignment, with their final values.
 * @param errors The errors of all lines, in input order.
 */
public record SessionReport(
        List<LineOutcome> outcomes,
        Map<String, BigInteger> usedVariables,
        List<Diagnostic> errors
) {
    public SessionReport {
        outcomes = List.copyOf(outcomes);
        usedVariables = Collections.unmodifiableMap(new LinkedHashMap<>(usedVariables));
        errors = List.copyOf(errors);
    }

    public static SessionReport empty() {
        return new SessionReport(List.of(), Map.of(), List.of());
    }

    /**
     * @return The errors rendered as "Line n: message".
     */
    public List<String> errorMessages() {
        return errors.stream().map(Diagnostic::toString).toList();
    }
}
