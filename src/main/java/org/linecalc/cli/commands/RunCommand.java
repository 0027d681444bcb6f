package org.linecalc.cli.commands;

import com.typesafe.config.ConfigException;
import org.linecalc.api.IInterpreter;
import org.linecalc.api.SessionReport;
import org.linecalc.cli.CommandLineInterface;
import org.linecalc.cli.rendering.IReportRenderer;
import org.linecalc.cli.rendering.JsonReportRenderer;
import org.linecalc.cli.rendering.TextReportRenderer;
import org.linecalc.config.ReportSettings;
import org.linecalc.interpreter.Interpreter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "run", description = "Runs a program from a file or standard input and prints the report.")
public class RunCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    /** Exit code for input that cannot be read. */
    public static final int EXIT_UNREADABLE_INPUT = 1;
    /** Exit code for empty input or an unusable configuration. */
    public static final int EXIT_USAGE = 2;

    @Parameters(index = "0", arity = "0..1", paramLabel = "FILE",
            description = "The program file to run. Reads standard input if absent or '-'.")
    private String file;

    @Option(names = {"-f", "--format"}, description = "Report format, case-insensitive: ${COMPLETION-CANDIDATES} (default: from configuration).")
    private ReportSettings.Format format;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ReportSettings settings;
        try {
            settings = ReportSettings.fromConfig(parent.getConfig());
        } catch (ConfigException | IllegalArgumentException e) {
            err.println("Failed to load configuration: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (format != null) {
            settings = settings.withFormat(format);
        }

        String input;
        try {
            input = readInput();
        } catch (IOException e) {
            LOG.error("Failed to read input '{}'", describeInput(), e);
            err.println("Failed to read file: " + e.getMessage());
            return EXIT_UNREADABLE_INPUT;
        }
        if (input.isBlank()) {
            err.println("No input: the program is empty.");
            return EXIT_USAGE;
        }

        IInterpreter interpreter = new Interpreter();
        SessionReport report = interpreter.run(input);
        out.print(rendererFor(settings).render(input, report));
        out.flush();
        return 0;
    }

    private String readInput() throws IOException {
        if (file == null || "-".equals(file)) {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(new File(file).toPath(), StandardCharsets.UTF_8);
    }

    private String describeInput() {
        return file == null ? "<stdin>" : file;
    }

    private static IReportRenderer rendererFor(ReportSettings settings) {
        return switch (settings.format()) {
            case TEXT -> new TextReportRenderer(settings);
            case JSON -> new JsonReportRenderer();
        };
    }
}
