package org.monkey.cli.commands;

import org.monkey.cli.CommandLineInterface;
import org.monkey.compiler.diagnostics.DiagnosticsEngine;
import org.monkey.compiler.frontend.lexer.Lexer;
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

@Command(
    name = "tokenize",
    mixinStandardHelpOptions = true,
    description = "Scans a source file and prints its tokens, one per line. "
        + "Exits with 1 if the file contains lexical errors, 2 if it cannot be read."
)
public class TokenizeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TokenizeCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", description = "The source file to scan (UTF-8).")
    private File file;

    @Option(names = "--positions", description = "Print line and column next to every token.")
    private boolean positions;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        parent.getConfig();

        if (!file.isFile()) {
            log.error("File not found: {}", file.getAbsolutePath());
            return 2;
        }
        final String source;
        try {
            source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to read {}: {}", file.getAbsolutePath(), e.getMessage());
            return 2;
        }

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer(source, diagnostics, file.getName());
        PrintWriter out = spec.commandLine().getOut();
        lexer.tokens().forEach(token -> out.println(positions ? token.describe() : token.toString()));
        out.flush();

        if (diagnostics.hasErrors()) {
            PrintWriter err = spec.commandLine().getErr();
            err.println(diagnostics.summary());
            err.flush();
            return 1;
        }
        return 0;
    }
}
