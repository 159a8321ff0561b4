package org.irnorm.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.irnorm.cli.commands.NormalizeCommand;
import org.irnorm.cli.commands.PassesCommand;
import org.irnorm.config.ConfigLoader;
import org.irnorm.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "irnorm",
    mixinStandardHelpOptions = true,
    version = "irnorm 1.0",
    description = "Normalizes lowered IR trees into idiomatic target-language shape",
    subcommands = {
        NormalizeCommand.class,
        PassesCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: irnorm.conf)"
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
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("irnorm");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging block.
     *
     * @return The resolved configuration.
     * @throws IllegalArgumentException if the file given with {@code --config} does not exist
     *         or the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        if (configFile != null && !configFile.exists()) {
            LOG.error("Configuration file specified via --config was not found: {}", configFile.getAbsolutePath());
            throw new IllegalArgumentException("Configuration file not found: " + configFile);
        }
        try {
            config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
        } catch (ConfigException e) {
            LOG.error("Failed to load or parse configuration: {}", e.getMessage());
            throw new IllegalArgumentException("Invalid configuration: " + e.getMessage(), e);
        }
        LoggingConfigurator.configure(config);
        return config;
    }
}
