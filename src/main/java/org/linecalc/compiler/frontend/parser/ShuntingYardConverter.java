package org.linecalc.compiler.frontend.parser;

import org.linecalc.compiler.frontend.lexer.Token;
import org.linecalc.compiler.frontend.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Converts an infix token sequence into postfix (Reverse Polish) order using the
 * Shunting-yard algorithm.
 * <p>
 * Operators of equal precedence are left-associative. Neither parenthesis balance nor
 * operator arity is checked here: an unmatched {@code ')'} pops the whole stack, an
 * unmatched {@code '('} is flushed into the output, and both surface later as an
 * evaluation fault.
 */
public class ShuntingYardConverter {

    private static final Logger LOG = LoggerFactory.getLogger(ShuntingYardConverter.class);

    /**
     * Converts infix tokens to postfix.
     * @param tokens The tokens in source order.
     * @return The postfix token sequence.
     */
    public List<Token> toPostfix(List<Token> tokens) {
        List<Token> output = new ArrayList<>();
        Deque<Token> ops = new ArrayDeque<>();

        for (Token token : tokens) {
            switch (token.type()) {
                case NUMBER, IDENTIFIER -> output.add(token);
                case LEFT_PAREN -> ops.push(token);
                case RIGHT_PAREN -> closeParen(output, ops);
                case OPERATOR -> {
                    int precedence = Operator.precedenceOf(token);
                    while (!ops.isEmpty() && Operator.precedenceOf(ops.peek()) >= precedence) {
                        output.add(ops.pop());
                    }
                    ops.push(token);
                }
            }
        }
        while (!ops.isEmpty()) {
            output.add(ops.pop());
        }

        if (LOG.isTraceEnabled()) {
            LOG.trace("Postfix of {} is {}", tokens, output);
        }
        return output;
    }

    private void closeParen(List<Token> output, Deque<Token> ops) {
        while (!ops.isEmpty() && ops.peek().type() != TokenType.LEFT_PAREN) {
            output.add(ops.pop());
        }
        if (!ops.isEmpty()) {
            ops.pop(); // the matching '('
        }
    }
}
