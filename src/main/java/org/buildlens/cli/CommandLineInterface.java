package org.buildlens.cli;

import com.typesafe.config.Config;
import org.buildlens.cli.commands.ReplayCommand;
import org.buildlens.cli.config.ConfigLoader;
import org.buildlens.cli.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "buildlens",
    mixinStandardHelpOptions = true,
    version = "buildlens 1.0",
    description = "Translates compiler problems into build server diagnostics notifications.",
    subcommands = {
        ReplayCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: buildlens.conf in the working directory)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Creates the command line with the root command and all subcommands registered.
     *
     * @return The command line.
     */
    public static CommandLine createCommandLine() {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("buildlens");
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The resolved configuration.
     * @throws IllegalArgumentException if the configured file does not exist.
     */
    public synchronized Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
