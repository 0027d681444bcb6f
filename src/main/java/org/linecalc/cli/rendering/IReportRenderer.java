package org.linecalc.cli.rendering;

import org.linecalc.api.SessionReport;

/**
 * Turns a session report into the text printed by the command line shell.
 */
public interface IReportRenderer {

    /**
     * @param input The raw program text the report was produced from.
     * @param report The session report.
     * @return The rendered report, ending with a newline.
     */
    String render(String input, SessionReport report);
}
