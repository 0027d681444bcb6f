package org.linecalc.compiler.backend.eval;

import org.linecalc.api.ErrorKind;
import org.linecalc.compiler.frontend.lexer.Token;
import org.linecalc.compiler.frontend.parser.Operator;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Evaluates a postfix token sequence on an operand stack.
 */
public class PostfixEvaluator {

    /**
     * Evaluates postfix tokens against a read-only set of variable bindings.
     * @param postfix The tokens in postfix order.
     * @param bindings Variable name to value; not modified.
     * @return The single remaining stack value, or a fault.
     */
    public Evaluation evaluate(List<Token> postfix, Map<String, BigInteger> bindings) {
        Deque<BigInteger> stack = new ArrayDeque<>();
        for (Token tk : postfix) {
            switch (tk.type()) {
                case NUMBER -> stack.push(tk.value());
                case IDENTIFIER -> {
                    BigInteger bound = bindings.get(tk.text());
                    if (bound == null) {
                        return Evaluation.fault(ErrorKind.UNDEFINED_VARIABLE, tk.text());
                    }
                    stack.push(bound);
                }
                case OPERATOR -> {
                    if (stack.size() < 2) {
                        return Evaluation.fault(ErrorKind.INVALID_EXPRESSION);
                    }
                    BigInteger b = stack.pop();
                    BigInteger a = stack.pop();
                    Operator op = Operator.fromSymbol(tk.text());
                    if (op.isDivision() && b.signum() == 0) {
                        return Evaluation.fault(ErrorKind.DIVISION_BY_ZERO);
                    }
                    stack.push(op.apply(a, b));
                }
                // an unmatched parenthesis flushed by the converter
                case LEFT_PAREN, RIGHT_PAREN -> {
                    return Evaluation.fault(ErrorKind.INVALID_EXPRESSION);
                }
            }
        }

        if (stack.size() != 1) {
            return Evaluation.fault(ErrorKind.INVALID_EXPRESSION);
        }
        return Evaluation.of(stack.pop());
    }
}
