package org.conflux.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.conflux.cli.commands.RunCommand;
import org.conflux.cli.commands.ValidateCommand;
import org.conflux.config.LoggingConfigurator;
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
    name = "conflux",
    mixinStandardHelpOptions = true,
    version = "Conflux 1.0",
    description = "Conflux - resource conversion and flow engine",
    subcommands = {
        RunCommand.class,
        ValidateCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file overriding the engine defaults"
    )
    private File configFile;

    @Option(names = {"-v", "--verbose"}, description = "Log engine internals at DEBUG level")
    private boolean verbose;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("conflux");
        System.exit(commandLine.execute(args));
    }

    /**
     * Returns the merged configuration, loading it on first use.
     * Load order: system properties, environment, {@code --config} file, classpath defaults.
     *
     * @throws CommandLine.ParameterException if the configuration file is missing or invalid
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        try {
            Config fileConfig = ConfigFactory.empty();
            if (configFile != null) {
                if (!configFile.isFile()) {
                    throw new CommandLine.ParameterException(spec.commandLine(),
                            "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
                }
                LOG.info("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(configFile);
            }
            config = ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.systemEnvironment())
                    .withFallback(fileConfig)
                    .withFallback(ConfigFactory.load())
                    .resolve();
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load or parse configuration: " + e.getMessage(), e, null, null);
        }

        LoggingConfigurator.configure(config);
        if (verbose) {
            LoggingConfigurator.enableVerbose();
        }
        return config;
    }
}
