package org.linecalc.interpreter;

import org.linecalc.compiler.diagnostics.DiagnosticsEngine;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state threaded through all lines of one session: the variable store,
 * the set of assigned names and the error accumulator. Not thread-safe; one
 * instance belongs to exactly one run.
 */
public class SessionContext {

    private final VariableStore variables = new VariableStore();
    private final Set<String> usedVariables = new LinkedHashSet<>();
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    public VariableStore variables() {
        return variables;
    }

    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    /**
     * Binds a variable and records it as used.
     * @param name The assignment target.
     * @param value The assigned value.
     */
    public void assign(String name, BigInteger value) {
        variables.bind(name, value);
        usedVariables.add(name);
    }

    /**
     * @return The assigned names in order of first assignment, mapped to their current values.
     */
    public Map<String, BigInteger> usedVariables() {
        Map<String, BigInteger> result = new LinkedHashMap<>();
        for (String name : usedVariables) {
            result.put(name, variables.get(name));
        }
        return Collections.unmodifiableMap(result);
    }
}
