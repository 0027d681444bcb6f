package org.linecalc.cli.rendering;

import org.linecalc.api.LineOutcome;
import org.linecalc.api.SessionReport;
import org.linecalc.compiler.diagnostics.Diagnostic;
import org.linecalc.config.ReportSettings;

import java.math.BigInteger;
import java.util.Map;

/**
 * Renders a report as human-readable text: the per-line results, then the used
 * variables, then the errors.
 */
public class TextReportRenderer implements IReportRenderer {

    private final ReportSettings settings;

    public TextReportRenderer(ReportSettings settings) {
        this.settings = settings;
    }

    @Override
    public String render(String input, SessionReport report) {
        StringBuilder sb = new StringBuilder();
        if (settings.echoInput()) {
            sb.append("Input lines:\n").append(input).append("\n\n");
        }
        sb.append("Output:\n");
        for (LineOutcome outcome : report.outcomes()) {
            sb.append("Line ").append(outcome.lineNumber()).append(": ").append(outcome.source()).append('\n');
            sb.append("Postfix: ").append(outcome.postfixText()).append('\n');
            sb.append("Result: ").append(resultText(outcome)).append("\n\n");
        }

        sb.append(settings.separator()).append('\n');
        sb.append("Variables used:\n");
        if (report.usedVariables().isEmpty()) {
            sb.append("No variables were used\n");
        } else {
            for (Map.Entry<String, BigInteger> entry : report.usedVariables().entrySet()) {
                sb.append(entry.getKey()).append(" = ").append(entry.getValue()).append('\n');
            }
        }

        sb.append(settings.separator()).append('\n');
        sb.append("Errors found:\n");
        if (report.errors().isEmpty()) {
            sb.append("No errors detected\n");
        } else {
            for (Diagnostic error : report.errors()) {
                sb.append(error).append('\n');
            }
        }
        return sb.toString();
    }

    private static String resultText(LineOutcome outcome) {
        if (outcome.isError()) {
            return "Error: " + outcome.fault().message();
        }
        return outcome.value().toString();
    }
}
