package org.monkey.compiler.diagnostics;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs while scanning source text.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param fileName The logical name of the source the issue occurred in.
 * @param lineNumber The line number of the issue.
 * @param column The column of the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber,
        int column
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error in the source, such as an unrecognized character. */
        ERROR,
        /** A warning that does not make the input invalid. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", type, fileName, lineNumber, column, message);
    }
}
