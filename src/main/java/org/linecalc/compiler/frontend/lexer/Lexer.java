package org.linecalc.compiler.frontend.lexer;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) converts the expression part of
 * a line into a flat sequence of tokens.
 * <p>
 * Digit runs become {@link TokenType#NUMBER}, a letter followed by letters or digits
 * becomes a single {@link TokenType#IDENTIFIER}, and each of {@code + - * / % ( )} is a
 * one-character token. Every other character, whitespace included, is skipped.
 */
public class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new Lexer.
     * @param source The expression text to tokenize.
     */
    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Performs the tokenization of the entire expression.
     * @return The recognized tokens in source order; empty for empty input.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        return List.copyOf(tokens);
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '+', '-', '*', '/', '%': addToken(TokenType.OPERATOR); break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                }
                // Anything else is ignored.
                break;
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void number() {
        while (isDigit(peek())) advance();
        String digits = source.substring(start, current);
        addToken(TokenType.NUMBER, new BigInteger(digits));
    }

    private char advance() {
        return source.charAt(current++);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, BigInteger value) {
        tokens.add(new Token(type, source.substring(start, current), value));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
