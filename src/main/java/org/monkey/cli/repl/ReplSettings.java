package org.monkey.cli.repl;

import com.typesafe.config.Config;

/**
 * Options of an interactive session, read from the {@code repl} block of the configuration.
 *
 * @param prompt The prompt printed before every line.
 * @param showPositions Whether every token is followed by its line and column.
 * @param showDiagnostics Whether lexical errors of a line are printed after its tokens.
 */
public record ReplSettings(String prompt, boolean showPositions, boolean showDiagnostics) {

    public static final String DEFAULT_PROMPT = ">> ";

    public static ReplSettings defaults() {
        return new ReplSettings(DEFAULT_PROMPT, false, true);
    }

    /**
     * Reads the settings from a configuration. Missing keys keep their default.
     *
     * @param config The application configuration.
     * @return The settings.
     */
    public static ReplSettings fromConfig(Config config) {
        ReplSettings defaults = defaults();
        if (!config.hasPath("repl")) {
            return defaults;
        }
        Config repl = config.getConfig("repl");
        return new ReplSettings(
                repl.hasPath("prompt") ? repl.getString("prompt") : defaults.prompt(),
                repl.hasPath("show-positions") ? repl.getBoolean("show-positions") : defaults.showPositions(),
                repl.hasPath("show-diagnostics") ? repl.getBoolean("show-diagnostics") : defaults.showDiagnostics());
    }

    public ReplSettings withShowPositions(boolean show) {
        return new ReplSettings(prompt, show, showDiagnostics);
    }
}
