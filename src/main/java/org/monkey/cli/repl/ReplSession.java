package org.monkey.cli.repl;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;
import org.monkey.compiler.diagnostics.DiagnosticsEngine;
import org.monkey.compiler.frontend.lexer.Lexer;
import org.monkey.compiler.frontend.lexer.Token;
import org.monkey.compiler.frontend.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;

/**
 * Read-print loop over a {@link LineReader}: every line entered is scanned by a fresh
 * {@link Lexer} and its tokens are printed, one per line, up to and including END_OF_FILE.
 * <p>
 * The session ends on {@code exit}, {@code quit} or end of input (Ctrl-D). Ctrl-C discards
 * the line being edited.
 */
public class ReplSession {

    private static final Logger log = LoggerFactory.getLogger(ReplSession.class);
    private static final String SOURCE_NAME = "<repl>";

    private final LineReader lineReader;
    private final PrintWriter out;
    private final ReplSettings settings;

    public ReplSession(LineReader lineReader, PrintWriter out, ReplSettings settings) {
        this.lineReader = lineReader;
        this.out = out;
        this.settings = settings;
    }

    /**
     * Runs the loop until the user leaves the session.
     * @return The number of lines that were scanned.
     */
    public int run() {
        log.debug("REPL session started with prompt '{}'", settings.prompt());
        int lines = 0;
        while (true) {
            String line;
            try {
                line = lineReader.readLine(settings.prompt());
            } catch (UserInterruptException e) {
                log.trace("Line discarded by user interrupt");
                continue;
            } catch (EndOfFileException e) {
                break;
            }
            if (line == null || isExitCommand(line)) {
                break;
            }
            printTokens(line);
            lines++;
        }
        out.flush();
        log.debug("REPL session ended after {} line(s)", lines);
        return lines;
    }

    /**
     * Scans a single line and prints its tokens, stopping right after END_OF_FILE.
     *
     * @param line The text to scan.
     * @return {@code true} if the line scanned without lexical errors.
     */
    public boolean printTokens(String line) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer(line, diagnostics, SOURCE_NAME);
        Token token;
        do {
            token = lexer.nextToken();
            out.println(settings.showPositions() ? token.describe() : token.toString());
        } while (!token.is(TokenType.END_OF_FILE));

        if (settings.showDiagnostics() && diagnostics.hasErrors()) {
            out.println(diagnostics.summary());
        }
        out.flush();
        return !diagnostics.hasErrors();
    }

    private static boolean isExitCommand(String line) {
        String trimmed = line.trim();
        return "exit".equals(trimmed) || "quit".equals(trimmed);
    }
}
