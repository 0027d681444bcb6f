package org.linecalc.compiler.frontend.lexer;

import java.math.BigInteger;

/**
 * Represents a single token extracted from an expression by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., Number, Identifier, Operator).
 * @param text The exact text of the token from the source.
 * @param value The integer value of a {@link TokenType#NUMBER} token, otherwise {@code null}.
 */
public record Token(
        TokenType type,
        String text,
        BigInteger value
) {

    /**
     * @return {@code true} if this token names a variable.
     */
    public boolean isIdentifier() {
        return type == TokenType.IDENTIFIER;
    }

    @Override
    public String toString() {
        return text;
    }
}
