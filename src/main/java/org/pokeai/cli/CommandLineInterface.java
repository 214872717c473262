package org.pokeai.cli;

import com.typesafe.config.Config;
import org.pokeai.cli.commands.BatchCommand;
import org.pokeai.cli.commands.SimulateCommand;
import org.pokeai.config.ConfigLoader;
import org.pokeai.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "pokeai",
    mixinStandardHelpOptions = true,
    version = "PokeAI Battle Engine 1.0",
    description = "PokeAI - deterministic turn-based battle simulation",
    subcommands = {
        SimulateCommand.class,
        BatchCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
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
        commandLine.setCommandName("pokeai");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * The merged configuration, loaded on first use. Logging levels are applied at the same time.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
