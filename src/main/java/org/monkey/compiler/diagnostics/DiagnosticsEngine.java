package org.monkey.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostic messages (errors, warnings) reported while scanning.
 * <p>
 * The lexer never throws on bad input; it reports here and keeps going, and the caller
 * decides whether to abort, skip or print the problems.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message    The error message.
     * @param fileName   The source in which the error occurred.
     * @param lineNumber The line number of the error.
     * @param column     The column of the error.
     */
    public void reportError(String message, String fileName, int lineNumber, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, fileName, lineNumber, column));
    }

    /**
     * Reports a warning.
     *
     * @param message    The warning message.
     * @param fileName   The source in which the warning occurred.
     * @param lineNumber The line number of the warning.
     * @param column     The column of the warning.
     */
    public void reportWarning(String message, String fileName, int lineNumber, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, fileName, lineNumber, column));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }

    /** Discards all collected diagnostics. */
    public void clear() {
        diagnostics.clear();
    }
}
