package org.kaleidoscope.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.kaleidoscope.cli.commands.ParseCommand;
import org.kaleidoscope.cli.commands.ReplCommand;
import org.kaleidoscope.cli.config.LoggingConfigurator;
import org.kaleidoscope.compiler.diagnostics.CompilerLogger;
import org.kaleidoscope.compiler.frontend.parser.PrecedenceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

@Command(
    name = "kaleidoscope",
    mixinStandardHelpOptions = true,
    version = "Kaleidoscope frontend 1.0",
    description = "Kaleidoscope - lexer and parser for the Kaleidoscope toy language",
    subcommands = {
        ParseCommand.class,
        ReplCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
    private static final String CONFIG_FILE_NAME = "kaleidoscope.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + CONFIG_FILE_NAME + " if present)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    /**
     * Creates the configured picocli command line, shared by {@link #main(String[])} and tests.
     * @return The command line.
     */
    public static CommandLine newCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("kaleidoscope");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    /**
     * Loads the configuration on first use. Load order:
     * System Props > Env Vars > --config file (or ./kaleidoscope.conf) > classpath defaults.
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if the configuration file is missing or invalid.
     */
    public Config getConfig() {
        if (config == null) {
            final Config loaded = loadConfig();
            LoggingConfigurator.configure(loaded);
            if (loaded.hasPath(CompilerLogger.CONFIG_PATH)) {
                CompilerLogger.setLevel(readSetting(() -> loaded.getInt(CompilerLogger.CONFIG_PATH)));
            }
            config = loaded;
        }
        return config;
    }

    /**
     * Reads the operator table from the configuration.
     * @return A new table.
     * @throws CommandLine.ParameterException if an operator entry is invalid.
     */
    public PrecedenceTable getPrecedenceTable() {
        final Config loaded = getConfig();
        return readSetting(() -> PrecedenceTable.fromConfig(loaded));
    }

    private <T> T readSetting(final Supplier<T> reader) {
        try {
            return reader.get();
        } catch (final ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Invalid configuration: " + e.getMessage(), e);
        }
    }

    private Config loadConfig() {
        File file = configFile;
        if (file == null) {
            final File cwdConfigFile = new File(CONFIG_FILE_NAME);
            if (cwdConfigFile.exists()) {
                file = cwdConfigFile;
            }
        } else if (!file.exists()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Configuration file specified via --config was not found: " + file.getAbsolutePath());
        }

        try {
            Config base = ConfigFactory.load();
            if (file != null) {
                logger.info("Using configuration file: {}", file.getAbsolutePath());
                base = ConfigFactory.parseFile(file).withFallback(base);
            } else {
                logger.debug("No '{}' found, using default configuration from classpath.", CONFIG_FILE_NAME);
            }
            return ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.systemEnvironment())
                    .withFallback(base)
                    .resolve();
        } catch (final ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load or parse configuration: " + e.getMessage(), e);
        }
    }
}
