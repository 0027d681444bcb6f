package org.linecalc.api;

import org.linecalc.compiler.internal.i18n.Messages;

/**
 * Defines the kinds of line-scoped faults the interpreter can report.
 * Each kind carries a stable message key so that tests can match on the kind
 * rather than on the translated text.
 */
public enum ErrorKind {
    /** The assignment target does not match {@code [A-Za-z][A-Za-z0-9]*}. */
    INVALID_VARIABLE_NAME("error.invalid-variable-name"),
    /** The line contains more than one {@code '='}. */
    MALFORMED_ASSIGNMENT("error.malformed-assignment"),
    /** An identifier was referenced before any successful assignment bound it. */
    UNDEFINED_VARIABLE("error.undefined-variable"),
    /** {@code /} or {@code %} with a zero right operand. */
    DIVISION_BY_ZERO("error.division-by-zero"),
    /** Operand stack underflow or leftover operands, e.g. an empty or operator-only expression. */
    INVALID_EXPRESSION("error.invalid-expression");

    private final String messageKey;

    ErrorKind(String messageKey) {
        this.messageKey = messageKey;
    }

    public String messageKey() {
        return messageKey;
    }

    /**
     * Renders the human-readable message for this kind.
     * @param args The message arguments, e.g. the offending name.
     * @return The formatted message.
     */
    public String format(Object... args) {
        return Messages.get(messageKey, args);
    }
}
