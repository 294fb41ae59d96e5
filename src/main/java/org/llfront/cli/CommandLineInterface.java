package org.llfront.cli;

import com.typesafe.config.Config;
import org.llfront.cli.commands.ParseCommand;
import org.llfront.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "llfront",
    mixinStandardHelpOptions = true,
    version = "llfront 1.0",
    description = "llfront - reads LLVM textual IR into a typed model",
    subcommands = {
        ParseCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: llfront.conf)"
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("llfront");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use. An explicit {@code --config} file must exist.
     * @return The resolved configuration.
     */
    public Config getConfig() {
        if (config == null) {
            if (configFile != null && !configFile.isFile()) {
                LOG.error("Configuration file specified via --config was not found: {}", configFile.getAbsolutePath());
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file not found: " + configFile.getPath());
            }
            config = ConfigLoader.load(configFile);
        }
        return config;
    }
}
