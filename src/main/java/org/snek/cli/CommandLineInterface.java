package org.snek.cli;

import com.typesafe.config.Config;
import org.snek.cli.commands.ReplayCommand;
import org.snek.node.config.ConfigLoader;
import org.snek.node.config.LoggingConfigurator;
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
    name = "snek",
    mixinStandardHelpOptions = true,
    version = "Snek 1.0",
    description = "Snek - headless driver for the snake grid simulation",
    subcommands = {
        ReplayCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        spec.commandLine().getOut().flush();
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("snek");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging section.
     *
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if {@code --config} names a missing file.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        if (configFile != null) {
            if (!configFile.exists()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                    "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
            }
            LOG.info("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
            config = ConfigLoader.load(configFile);
        } else {
            config = ConfigLoader.load();
        }
        LoggingConfigurator.configure(config);
        return config;
    }
}
