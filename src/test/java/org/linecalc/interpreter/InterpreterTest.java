package org.linecalc.interpreter;

import org.linecalc.api.ErrorKind;
import org.linecalc.api.IInterpreter;
import org.linecalc.api.LineOutcome;
import org.linecalc.api.SessionReport;
import org.linecalc.compiler.diagnostics.Diagnostic;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Session-level tests for the {@link Interpreter}: line ordering, blank line handling,
 * error accumulation and isolation between runs.
 */
public class InterpreterTest {

    private final IInterpreter interpreter = new Interpreter();

    /**
     * Verifies that a value assigned on one line is visible on the next.
     */
    @Test
    @Tag("unit")
    void assignmentThenReferenceRoundTrips() {
        SessionReport report = interpreter.run("x = 5\nx + 1");

        assertThat(report.outcomes()).extracting(LineOutcome::value)
                .containsExactly(BigInteger.valueOf(5), BigInteger.valueOf(6));
        assertThat(report.usedVariables()).containsExactly(entry("x", BigInteger.valueOf(5)));
        assertThat(report.errors()).isEmpty();
    }

    /**
     * Verifies that blank lines produce no outcome but still count for line numbers.
     */
    @Test
    @Tag("unit")
    void blankLinesAreSkippedButKeepNumbering() {
        SessionReport report = interpreter.run("\n   \na = 1\n\n\t\nb = a / 0\n");

        assertThat(report.outcomes()).extracting(LineOutcome::lineNumber).containsExactly(3, 6);
        assertThat(report.errorMessages()).containsExactly("Line 6: Division by zero");
    }

    /**
     * Verifies that every kind of error is recorded and processing continues with the next line.
     */
    @Test
    @Tag("unit")
    void errorsDoNotStopLaterLines() {
        String program = String.join("\n",
                "a = 10",
                "1x = 2",
                "b = c + 1",
                "d = a % 0",
                "e = a = 1",
                "a * 2",
                "f = )",
                "g = a - 3");

        SessionReport report = interpreter.run(program);

        assertThat(report.outcomes()).hasSize(8);
        assertThat(report.errors()).extracting(Diagnostic::kind).containsExactly(
                ErrorKind.INVALID_VARIABLE_NAME,
                ErrorKind.UNDEFINED_VARIABLE,
                ErrorKind.DIVISION_BY_ZERO,
                ErrorKind.MALFORMED_ASSIGNMENT,
                ErrorKind.INVALID_EXPRESSION);
        assertThat(report.errorMessages()).containsExactly(
                "Line 2: Invalid variable name: '1x'",
                "Line 3: Undefined variable 'c'",
                "Line 4: Division by zero",
                "Line 5: Multiple assignment targets are not allowed",
                "Line 7: Invalid expression");
        assertThat(report.outcomes().get(5).value()).isEqualTo(BigInteger.valueOf(20));
        assertThat(report.usedVariables()).containsExactly(
                entry("a", BigInteger.valueOf(10)),
                entry("g", BigInteger.valueOf(7)));
    }

    /**
     * Verifies that used variables are listed in first-assignment order with their final values.
     */
    @Test
    @Tag("unit")
    void usedVariablesKeepFirstAssignmentOrderWithFinalValues() {
        SessionReport report = interpreter.run("b = 1\na = 2\nb = b + a");

        assertThat(report.usedVariables()).containsExactly(
                entry("b", BigInteger.valueOf(3)),
                entry("a", BigInteger.valueOf(2)));
    }

    /**
     * Verifies that CRLF line endings split lines like LF.
     */
    @Test
    @Tag("unit")
    void windowsLineEndingsAreHandled() {
        SessionReport report = interpreter.run("x = 2\r\nx * 21\r\n");

        assertThat(report.outcomes()).extracting(LineOutcome::value)
                .containsExactly(BigInteger.valueOf(2), BigInteger.valueOf(42));
    }

    /**
     * Verifies that surrounding whitespace is trimmed from the reported source line.
     */
    @Test
    @Tag("unit")
    void surroundingWhitespaceIsTrimmedFromSource() {
        SessionReport report = interpreter.run("   (1 + 2) * 3   ");

        assertThat(report.outcomes()).singleElement().satisfies(outcome -> {
            assertThat(outcome.source()).isEqualTo("(1 + 2) * 3");
            assertThat(outcome.postfixText()).isEqualTo("1 2 + 3 *");
            assertThat(outcome.value()).isEqualTo(BigInteger.valueOf(9));
        });
    }

    /**
     * Verifies that empty or whitespace-only input produces an empty report.
     */
    @Test
    @Tag("unit")
    void emptyOrBlankInputProducesEmptyReport() {
        assertThat(interpreter.run("")).isEqualTo(SessionReport.empty());
        assertThat(interpreter.run(" \n\t\n")).isEqualTo(SessionReport.empty());
    }

    /**
     * Verifies that variables do not survive from one run to the next.
     */
    @Test
    @Tag("unit")
    void eachRunStartsWithFreshVariables() {
        interpreter.run("x = 1");

        SessionReport second = interpreter.run("x + 1");

        assertThat(second.errorMessages()).containsExactly("Line 1: Undefined variable 'x'");
    }

    /**
     * Verifies that running the same input twice gives equal reports.
     */
    @Test
    @Tag("unit")
    void rerunningSameInputYieldsIdenticalReport() {
        String program = "a = 3\nb = a * (a + 1)\nc = b / 0\nb % 5\nz";

        assertThat(interpreter.run(program)).isEqualTo(interpreter.run(program));
    }

    /**
     * Verifies that the line prefix of an error does not depend on the default locale.
     */
    @Test
    @Tag("unit")
    void errorPrefixUsesAsciiDigitsInAnyLocale() {
        Locale original = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("ar-SA"));
            String program = "a = 1 / 0\n" + "1 + 1\n".repeat(11) + "1 / 0";

            SessionReport report = interpreter.run(program);

            assertThat(report.errorMessages()).containsExactly(
                    "Line 1: Division by zero",
                    "Line 13: Division by zero");
        } finally {
            Locale.setDefault(original);
        }
    }

    /**
     * Verifies that a program can be run from a UTF-8 file.
     */
    @Test
    @Tag("unit")
    void runsProgramFromFile(@TempDir Path dir) throws Exception {
        Path program = dir.resolve("program.txt");
        Files.writeString(program, "r = 6 * 7\n", StandardCharsets.UTF_8);

        SessionReport report = interpreter.run(program);

        assertThat(report.usedVariables()).containsExactly(entry("r", BigInteger.valueOf(42)));
    }

    /**
     * Verifies that a missing program file is reported as an I/O failure.
     */
    @Test
    @Tag("unit")
    void missingFileIsReportedAsIOException(@TempDir Path dir) {
        assertThatThrownBy(() -> interpreter.run(dir.resolve("missing.txt")))
                .isInstanceOf(NoSuchFileException.class);
    }
}
