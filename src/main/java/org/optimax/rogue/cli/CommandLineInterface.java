package org.optimax.rogue.cli;

import com.typesafe.config.Config;
import org.optimax.rogue.cli.commands.ServeCommand;
import org.optimax.rogue.server.config.ConfigLoader;
import org.optimax.rogue.server.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "rogue",
    mixinStandardHelpOptions = true,
    version = "Optimax Rogue 1.0",
    description = "Optimax Rogue - authoritative two-player roguelike duel server",
    subcommands = {
        ServeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " if present)"
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
        commandLine.setCommandName("rogue");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging block.
     *
     * @throws IllegalArgumentException if an explicit configuration file does not exist
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
