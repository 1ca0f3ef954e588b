package org.loxfront.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.loxfront.cli.commands.ParseCommand;
import org.loxfront.cli.commands.TokenizeCommand;
import org.loxfront.cli.config.ConfigLoader;
import org.loxfront.cli.config.LoggingConfigurator;
import org.loxfront.compiler.api.FrontEndOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "loxfront",
    mixinStandardHelpOptions = true,
    version = "loxfront 1.0",
    description = "Lexer and parser for the Lox scripting language",
    subcommands = {
        TokenizeCommand.class,
        ParseCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** The run produced no errors. */
    public static final int EXIT_OK = 0;
    /** The configuration could not be loaded, or an unexpected failure occurred. */
    public static final int EXIT_FAILURE = 1;
    /** The source contains lexical or syntax errors. */
    public static final int EXIT_DATA_ERROR = 65;
    /** The source file could not be read. */
    public static final int EXIT_NO_INPUT = 66;

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Builds the command line with the exception mapping used by {@link #main(String[])}.
     * @return The configured command line.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("loxfront");
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof ConfigException) {
                LOG.error("Failed to load or parse configuration: {}", ex.getMessage());
            } else {
                LOG.error("Command '{}' failed", cmd.getCommandName(), ex);
            }
            cmd.getErr().println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        });
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     * @return The resolved configuration.
     * @throws ConfigException if the configuration cannot be loaded.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    /**
     * @return The front end options taken from the configuration.
     */
    public FrontEndOptions getFrontEndOptions() {
        return FrontEndOptions.fromConfig(getConfig());
    }
}
