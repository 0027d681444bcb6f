package org.linecalc.cli.rendering;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.linecalc.api.LineOutcome;
import org.linecalc.api.SessionReport;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Renders a report as pretty-printed JSON. Absent fields (the value of an error line,
 * the error of a successful line) are omitted.
 */
public class JsonReportRenderer implements IReportRenderer {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    @Override
    public String render(String input, SessionReport report) {
        List<LineDto> lines = report.outcomes().stream().map(JsonReportRenderer::toDto).toList();
        ReportDto dto = new ReportDto(lines, report.usedVariables(), report.errorMessages());
        return gson.toJson(dto) + "\n";
    }

    private static LineDto toDto(LineOutcome outcome) {
        ErrorDto error = outcome.isError()
                ? new ErrorDto(outcome.fault().kind().name(), outcome.fault().message())
                : null;
        return new LineDto(outcome.lineNumber(), outcome.source(), outcome.assignedVariable(),
                outcome.postfixText(), outcome.value(), error);
    }

    record ReportDto(List<LineDto> lines, Map<String, BigInteger> variables, List<String> errors) {}

    record LineDto(int line, String source, String variable, String postfix, BigInteger result, ErrorDto error) {}

    record ErrorDto(String kind, String message) {}
}
