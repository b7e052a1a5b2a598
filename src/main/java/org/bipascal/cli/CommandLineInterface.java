package org.bipascal.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.bipascal.cli.commands.ParseCommand;
import org.bipascal.cli.commands.TokensCommand;
import org.bipascal.cli.config.LoggingConfigurator;
import org.bipascal.compiler.api.FrontendOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "bipascal",
    mixinStandardHelpOptions = true,
    version = "BiPascal 1.0",
    description = "BiPascal - lexer and parser for bilingual (English/Indonesian) Pascal-S",
    subcommands = {
        TokensCommand.class,
        ParseCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** Exit code for a run without source errors. */
    public static final int EXIT_OK = 0;
    /** Exit code when the source has lexical or syntax errors. */
    public static final int EXIT_SOURCE_ERRORS = 1;
    /** Exit code when a file cannot be found or read. */
    public static final int EXIT_IO_ERROR = 2;

    private static final String CONFIG_FILE_NAME = "bipascal.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: bipascal.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("bipascal");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            final File file;
            if (this.configFile != null) {
                // 1) Explicit CLI option --config
                if (!this.configFile.exists()) {
                    throw new CommandLine.ParameterException(spec.commandLine(),
                            "Configuration file specified via --config was not found: " + this.configFile.getAbsolutePath());
                }
                logger.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
                file = this.configFile;
            } else {
                // 2) bipascal.conf in the current working directory
                final File cwdConfigFile = new File(CONFIG_FILE_NAME);
                if (cwdConfigFile.exists()) {
                    logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                    file = cwdConfigFile;
                } else {
                    logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
                    file = null;
                }
            }

            // Config load order: System Props > Env Vars > File > Classpath defaults
            Config loaded = ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
            if (file != null) {
                loaded = loaded.withFallback(ConfigFactory.parseFile(file));
            }
            this.config = loaded.withFallback(ConfigFactory.load()).resolve();
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load or parse configuration: " + e.getMessage(), e, null, null);
        }

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * Reads the frontend options from the loaded configuration.
     * @return The options.
     * @throws CommandLine.ParameterException if the frontend block holds invalid values.
     */
    public FrontendOptions getFrontendOptions() {
        try {
            return FrontendOptions.fromConfig(getConfig());
        } catch (ConfigException | IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Invalid frontend configuration: " + e.getMessage());
        }
    }
}
