package org.linecalc.compiler.frontend.parser;

import org.linecalc.compiler.frontend.lexer.Token;
import org.linecalc.compiler.frontend.lexer.TokenType;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The binary arithmetic operators of the expression language, with their binding strength.
 * Division and modulo round toward negative infinity, so the remainder takes the sign of the divisor.
 */
public enum Operator {
    PLUS("+", 1),
    MINUS("-", 1),
    TIMES("*", 2),
    DIVIDE("/", 2),
    MODULO("%", 2);

    private static final Map<String, Operator> BY_SYMBOL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Operator::symbol, Function.identity()));

    private final String symbol;
    private final int precedence;

    Operator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    /**
     * @return {@code true} for the operators that fault on a zero right operand.
     */
    public boolean isDivision() {
        return this == DIVIDE || this == MODULO;
    }

    /**
     * Applies the operator to two operands. The caller must reject a zero divisor first.
     * @param a The left operand (pushed first).
     * @param b The right operand (pushed last).
     * @return {@code a <op> b}.
     */
    public BigInteger apply(BigInteger a, BigInteger b) {
        return switch (this) {
            case PLUS -> a.add(b);
            case MINUS -> a.subtract(b);
            case TIMES -> a.multiply(b);
            case DIVIDE -> floorDiv(a, b);
            case MODULO -> a.subtract(floorDiv(a, b).multiply(b));
        };
    }

    /**
     * Looks up an operator by its symbol.
     * @param symbol The operator text, e.g. "+".
     * @return The operator, or {@code null} if the symbol is not an operator.
     */
    public static Operator fromSymbol(String symbol) {
        return BY_SYMBOL.get(symbol);
    }

    /**
     * Returns the binding strength of a token: 1 for {@code + -}, 2 for {@code * / %},
     * 0 for everything else (including a parenthesis on the operator stack).
     * @param token The token to rank.
     * @return The precedence of the token.
     */
    public static int precedenceOf(Token token) {
        if (token.type() != TokenType.OPERATOR) {
            return 0;
        }
        Operator op = fromSymbol(token.text());
        return op == null ? 0 : op.precedence;
    }

    private static BigInteger floorDiv(BigInteger a, BigInteger b) {
        BigInteger[] qr = a.divideAndRemainder(b);
        if (qr[1].signum() != 0 && qr[1].signum() != b.signum()) {
            return qr[0].subtract(BigInteger.ONE);
        }
        return qr[0];
    }
}
