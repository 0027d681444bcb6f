package org.linecalc.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** A run of decimal digits, such as 42. */
    NUMBER,
    /** A letter followed by letters or digits, such as x1. */
    IDENTIFIER,

    // Single-character tokens.
    /** One of the arithmetic operators + - * / %. */
    OPERATOR,
    /** The '(' character. */
    LEFT_PAREN,
    /** The ')' character. */
    RIGHT_PAREN
}
