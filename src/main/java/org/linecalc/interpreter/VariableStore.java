package org.linecalc.interpreter;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Holds the variables bound during one session. A name is present only after a
 * successful assignment to it.
 */
public class VariableStore {

    private final Map<String, BigInteger> values = new HashMap<>();

    public boolean isBound(String name) {
        return values.containsKey(name);
    }

    /**
     * @param name The variable name.
     * @return The last assigned value, or {@code null} if the name is unbound.
     */
    public BigInteger get(String name) {
        return values.get(name);
    }

    public void bind(String name, BigInteger value) {
        values.put(name, value);
    }

    /**
     * @return An immutable copy of the current bindings.
     */
    public Map<String, BigInteger> snapshot() {
        return Map.copyOf(values);
    }
}
