package org.linecalc.cli;

import com.typesafe.config.Config;
import org.linecalc.cli.commands.RunCommand;
import org.linecalc.config.ConfigLoader;
import org.linecalc.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "linecalc",
    mixinStandardHelpOptions = true,
    version = "linecalc 1.0",
    description = "Evaluates line-oriented arithmetic programs and prints their postfix form and results",
    subcommands = {
        RunCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Builds the configured picocli command line. Enum values such as {@code --format json}
     * are matched case-insensitively.
     * @return A new command line rooted at {@code linecalc}.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("linecalc");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     * @return The resolved configuration.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     * @throws IllegalArgumentException if the file given with --config does not exist.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
