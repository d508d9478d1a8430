package org.alphacheck.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.alphacheck.cli.commands.CheckCommand;
import org.alphacheck.cli.commands.InspectCommand;
import org.alphacheck.cli.config.ConfigLoader;
import org.alphacheck.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Root {@code alphacheck} command. Owns the {@code --config} option and hands the resolved
 * configuration to its subcommands.
 */
@Command(
    name = "alphacheck",
    mixinStandardHelpOptions = true,
    version = "alphacheck 1.0",
    description = "alphacheck - verifies that required PNG assets keep their transparent pixels",
    subcommands = {
        CheckCommand.class,
        InspectCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Exit codes:",
        "  0  every required asset exists and contains transparency",
        "  1  at least one asset is missing, undecodable or fully opaque",
        "  2  invalid command line"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/alphacheck.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * @return the command line used by {@link #main(String[])}, for tests that need the same setup
     */
    public static CommandLine createCommandLine() {
        return new CommandLine(new CommandLineInterface())
            .setCaseInsensitiveEnumValuesAllowed(true);
    }

    /**
     * Resolves the configuration on first access and applies its {@code logging} block.
     *
     * @throws IllegalStateException if the configuration file is missing or cannot be parsed
     */
    public Config getConfig() {
        if (config == null) {
            try {
                Config resolved = ConfigLoader.resolve(configFile, (level, message) -> {
                    switch (level) {
                        case INFO -> log.debug(message);
                        case WARN -> log.warn(message);
                    }
                });
                LoggingConfigurator.configure(resolved);
                config = resolved;
            } catch (IllegalArgumentException | ConfigException e) {
                throw new IllegalStateException("Invalid configuration: " + e.getMessage(), e);
            }
        }
        return config;
    }
}
