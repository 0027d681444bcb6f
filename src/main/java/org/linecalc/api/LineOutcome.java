package org.linecalc.api;

import org.linecalc.compiler.backend.eval.Evaluation;
import org.linecalc.compiler.frontend.lexer.Token;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The result of processing one non-blank input line.
 *
 * @param lineNumber The 1-based position of the line in the input.
 * @param source The line text with surrounding whitespace removed.
 * @param assignedVariable The assignment target when the line bound a variable, otherwise {@code null}.
 * @param postfix The postfix tokens computed before the line finished or faulted; empty if conversion never ran.
 * @param result The value of the line, or the fault that stopped it.
 */
public record LineOutcome(
        int lineNumber,
        String source,
        String assignedVariable,
        List<Token> postfix,
        Evaluation result
) {
    public LineOutcome {
        postfix = List.copyOf(postfix);
    }

    public boolean isError() {
        return result.isFault();
    }

    /**
     * @return The value of a successful line, or {@code null} for an error line.
     */
    public BigInteger value() {
        return result instanceof Evaluation.Value v ? v.value() : null;
    }

    /**
     * @return The fault of an error line, or {@code null} for a successful line.
     */
    public Evaluation.Fault fault() {
        return result instanceof Evaluation.Fault f ? f : null;
    }

    /**
     * @return The postfix tokens joined by single spaces.
     */
    public String postfixText() {
        return postfix.stream().map(Token::text).collect(Collectors.joining(" "));
    }
}
