package org.linecalc.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface of the line interpreter.
 */
public interface IInterpreter {

    /**
     * Runs a complete program in a fresh session.
     *
     * @param source The full multi-line program text.
     * @return The session report. Line-level errors are part of the report and never thrown.
     */
    SessionReport run(String source);

    /**
     * Runs the program stored in a file.
     * @param programPath The path to a UTF-8 text file.
     * @return The session report.
     * @throws IOException if the file cannot be read.
     */
    default SessionReport run(Path programPath) throws IOException {
        return run(Files.readString(programPath, StandardCharsets.UTF_8));
    }
}
