package org.monkey.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.monkey.cli.commands.ReplCommand;
import org.monkey.cli.commands.TokenizeCommand;
import org.monkey.cli.config.ConfigLoader;
import org.monkey.cli.config.LoggingConfigurator;
import org.monkey.cli.repl.ReplSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.Callable;

@Command(
    name = "monkey",
    mixinStandardHelpOptions = true,
    version = "Monkey Lexer 1.0",
    description = "Scans Monkey source code into tokens. Starts the interactive REPL when no subcommand is given.",
    subcommands = {
        ReplCommand.class,
        TokenizeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: monkey.conf)"
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;

    @Override
    public Integer call() throws IOException {
        return ReplCommand.startRepl(ReplSettings.fromConfig(getConfig()));
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if {@code --config} names a missing or unparsable file.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        if (configFile != null && !configFile.isFile()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
        }
        try {
            config = ConfigLoader.load(configFile);
        } catch (ConfigException e) {
            LOG.error("Failed to load or parse configuration: {}", e.getMessage());
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid configuration: " + e.getMessage(), e);
        }
        LoggingConfigurator.configure(config);
        return config;
    }
}
