package org.linecalc.interpreter;

import org.linecalc.api.IInterpreter;
import org.linecalc.api.LineOutcome;
import org.linecalc.api.SessionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives one session: feeds every non-blank line to the {@link LineProcessor} in order,
 * threading a single {@link SessionContext} through the run, and assembles the report.
 * <p>
 * Each call to {@link #run(String)} starts from an empty variable store, so running the
 * same text twice yields equal reports. Instances hold no session state and may be reused,
 * but a single run is not meant to be shared across threads.
 */
public class Interpreter implements IInterpreter {

    private static final Logger LOG = LoggerFactory.getLogger(Interpreter.class);

    private final LineProcessor lineProcessor = new LineProcessor();

    @Override
    public SessionReport run(String source) {
        if (source == null || source.isBlank()) {
            return SessionReport.empty();
        }

        SessionContext context = new SessionContext();
        List<LineOutcome> outcomes = new ArrayList<>();
        List<String> lines = source.lines().toList();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.isEmpty()) {
                continue;
            }
            outcomes.add(lineProcessor.process(i + 1, line, context));
        }

        LOG.info("Processed {} line(s) with {} error(s).", outcomes.size(), context.diagnostics().getDiagnostics().size());
        if (context.diagnostics().hasErrors() && LOG.isDebugEnabled()) {
            LOG.debug("Errors:\n{}", context.diagnostics().summary());
        }
        return new SessionReport(outcomes, context.usedVariables(), context.diagnostics().getDiagnostics());
    }
}
