package org.monkey.cli.commands;

import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.monkey.cli.CommandLineInterface;
import org.monkey.cli.repl.ReplSession;
import org.monkey.cli.repl.ReplSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.util.concurrent.Callable;

@Command(
    name = "repl",
    mixinStandardHelpOptions = true,
    description = "Starts an interactive session that prints the tokens of every line entered."
)
public class ReplCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReplCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = "--positions", description = "Print line and column next to every token.")
    private boolean positions;

    @Override
    public Integer call() throws IOException {
        ReplSettings settings = ReplSettings.fromConfig(parent.getConfig());
        if (positions) {
            settings = settings.withShowPositions(true);
        }
        return startRepl(settings);
    }

    /**
     * Runs a REPL session on the system terminal until the user leaves it.
     *
     * @param settings The session options.
     * @return The exit code, always 0.
     * @throws IOException if no terminal at all can be opened.
     */
    public static int startRepl(ReplSettings settings) throws IOException {
        try (Terminal terminal = openTerminal()) {
            LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .history(new DefaultHistory())
                    .build();
            new ReplSession(lineReader, terminal.writer(), settings).run();
        }
        return 0;
    }

    private static Terminal openTerminal() throws IOException {
        try {
            return TerminalBuilder.builder().system(true).build();
        } catch (IOException | IllegalStateException e) {
            // No system terminal (e.g. inside an IDE or with redirected input).
            log.debug("System terminal unavailable, using a dumb terminal: {}", e.getMessage());
            return TerminalBuilder.builder().dumb(true).build();
        }
    }
}
