package org.genemeta.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.genemeta.cli.commands.AggregateCommand;
import org.genemeta.cli.commands.ServeCommand;
import org.genemeta.cli.commands.TopCommand;
import org.genemeta.cli.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "genemeta",
    mixinStandardHelpOptions = true,
    version = "genemeta 1.0",
    description = "Cross-study gene-pair meta-analysis aggregation engine",
    subcommands = {
        AggregateCommand.class,
        TopCommand.class,
        ServeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/genemeta.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // No subcommand given.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("genemeta");
        return commandLine;
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        final Config full = ConfigLoader.resolve(this.configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.info(message);
                case WARN -> logger.warn(message);
            }
        });
        this.config = full.getConfig(ConfigLoader.ROOT_PATH);

        if (config.hasPath("logging.level")) {
            applyRootLogLevel(config.getString("logging.level"));
        }
        initialized = true;
    }

    private static void applyRootLogLevel(final String level) {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(level, Level.INFO));
        }
    }

    /**
     * Returns the {@code genemeta} configuration block, loading it on first use.
     *
     * @throws IllegalArgumentException if an explicitly named configuration file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
