package org.linecalc.compiler.frontend.parser;

import org.linecalc.compiler.frontend.lexer.Lexer;
import org.linecalc.compiler.frontend.lexer.Token;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link ShuntingYardConverter}, checking postfix order for
 * precedence, associativity, grouping and the permissive handling of unbalanced parentheses.
 */
public class ShuntingYardConverterTest {

    private final ShuntingYardConverter converter = new ShuntingYardConverter();

    private String postfix(String infix) {
        return converter.toPostfix(new Lexer(infix).scanTokens()).stream()
                .map(Token::text)
                .collect(Collectors.joining(" "));
    }

    /**
     * Verifies that * is emitted before + when it binds tighter.
     */
    @Test
    @Tag("unit")
    void multiplicationBindsTighterThanAddition() {
        assertThat(postfix("2 + 3 * 4")).isEqualTo("2 3 4 * +");
    }

    /**
     * Verifies that a parenthesized group is emitted before the operator applied to it.
     */
    @Test
    @Tag("unit")
    void parenthesesOverridePrecedence() {
        assertThat(postfix("(2 + 3) * 4")).isEqualTo("2 3 + 4 *");
    }

    /**
     * Verifies that operators of equal precedence are emitted left to right.
     */
    @Test
    @Tag("unit")
    void equalPrecedenceIsLeftAssociative() {
        assertThat(postfix("10 - 4 - 3")).isEqualTo("10 4 - 3 -");
        assertThat(postfix("8 / 4 % 3 * 2")).isEqualTo("8 4 / 3 % 2 *");
    }

    /**
     * Verifies conversion of nested groups mixing identifiers and all precedence levels.
     */
    @Test
    @Tag("unit")
    void nestedGroupsWithVariables() {
        assertThat(postfix("a * (b + (c - d)) / e")).isEqualTo("a b c d - + * e /");
    }

    /**
     * Verifies that a lone operand is its own postfix form.
     */
    @Test
    @Tag("unit")
    void singleOperandPassesThrough() {
        assertThat(postfix("x")).isEqualTo("x");
    }

    /**
     * Verifies that an extra closing parenthesis empties the stack and is otherwise ignored.
     */
    @Test
    @Tag("unit")
    void unmatchedClosingParenthesisIsIgnored() {
        assertThat(postfix("1 + 2 ) * 3")).isEqualTo("1 2 + 3 *");
    }

    /**
     * Verifies that an unclosed opening parenthesis ends up in the output for the evaluator to reject.
     */
    @Test
    @Tag("unit")
    void unmatchedOpeningParenthesisIsFlushedToOutput() {
        assertThat(postfix("( 1 + 2")).isEqualTo("1 2 + (");
    }

    /**
     * Verifies that arity is not checked during conversion.
     */
    @Test
    @Tag("unit")
    void operatorsWithoutOperandsAreNotRejected() {
        assertThat(postfix("+ *")).isEqualTo("* +");
    }

    /**
     * Verifies that converting the same tokens twice gives the same postfix.
     */
    @Test
    @Tag("unit")
    void conversionIsDeterministic() {
        String infix = "(a + 2) * b % (7 - c)";
        assertThat(postfix(infix)).isEqualTo(postfix(infix));
    }
}
