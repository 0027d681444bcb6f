package org.linecalc.interpreter;

import org.linecalc.api.ErrorKind;
import org.linecalc.api.LineOutcome;
import org.linecalc.compiler.backend.eval.Evaluation;
import org.linecalc.compiler.backend.eval.PostfixEvaluator;
import org.linecalc.compiler.frontend.lexer.Lexer;
import org.linecalc.compiler.frontend.lexer.Token;
import org.linecalc.compiler.frontend.parser.ShuntingYardConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Processes a single line: either {@code name = expression} or a bare expression.
 * <p>
 * The steps are: split off and validate the assignment target, tokenize, check that
 * every identifier is bound, convert to postfix, evaluate, and finally bind the
 * target. The first failing step ends the line with an error outcome, which is also
 * recorded in the session diagnostics.
 */
public class LineProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(LineProcessor.class);
    private static final Pattern VARIABLE_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9]*");
    private static final String ASSIGN = "=";

    private final ShuntingYardConverter converter = new ShuntingYardConverter();
    private final PostfixEvaluator evaluator = new PostfixEvaluator();

    /**
     * Processes one non-blank line.
     *
     * @param lineNumber The 1-based line number, used to prefix error messages.
     * @param line The line text, already trimmed.
     * @param context The session state; updated on successful assignment and on error.
     * @return The outcome of the line.
     */
    public LineOutcome process(int lineNumber, String line, SessionContext context) {
        String target = null;
        String expression = line;

        if (line.contains(ASSIGN)) {
            String[] parts = line.split(ASSIGN, -1);
            if (parts.length != 2) {
                return fail(lineNumber, line, List.of(), Evaluation.fault(ErrorKind.MALFORMED_ASSIGNMENT), context);
            }
            target = parts[0].trim();
            if (!VARIABLE_NAME.matcher(target).matches()) {
                return fail(lineNumber, line, List.of(), Evaluation.fault(ErrorKind.INVALID_VARIABLE_NAME, target), context);
            }
            expression = parts[1];
        }

        List<Token> tokens = new Lexer(expression).scanTokens();
        if (tokens.isEmpty()) {
            return fail(lineNumber, line, List.of(), Evaluation.fault(ErrorKind.INVALID_EXPRESSION), context);
        }
        for (Token token : tokens) {
            if (token.isIdentifier() && !context.variables().isBound(token.text())) {
                return fail(lineNumber, line, List.of(),
                        Evaluation.fault(ErrorKind.UNDEFINED_VARIABLE, token.text()), context);
            }
        }

        List<Token> postfix = converter.toPostfix(tokens);
        Evaluation result = evaluator.evaluate(postfix, context.variables().snapshot());
        if (result instanceof Evaluation.Fault) {
            return fail(lineNumber, line, postfix, result, context);
        }

        Evaluation.Value value = (Evaluation.Value) result;
        if (target != null) {
            context.assign(target, value.value());
            LOG.debug("Line {}: {} = {}", lineNumber, target, value.value());
        } else {
            LOG.debug("Line {}: {}", lineNumber, value.value());
        }
        return new LineOutcome(lineNumber, line, target, postfix, result);
    }

    private LineOutcome fail(int lineNumber, String line, List<Token> postfix,
                             Evaluation result, SessionContext context) {
        Evaluation.Fault fault = (Evaluation.Fault) result;
        context.diagnostics().reportError(fault.kind(), fault.message(), lineNumber);
        LOG.debug("Line {} failed with {}: {}", lineNumber, fault.kind(), fault.message());
        // a failed line never binds its target
        return new LineOutcome(lineNumber, line, null, postfix, result);
    }
}
