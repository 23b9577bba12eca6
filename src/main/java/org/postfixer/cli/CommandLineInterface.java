package org.postfixer.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.postfixer.cli.commands.CompileCommand;
import org.postfixer.cli.commands.EvalCommand;
import org.postfixer.cli.commands.PostfixCommand;
import org.postfixer.cli.commands.ReplCommand;
import org.postfixer.cli.config.ConfigLoader;
import org.postfixer.cli.config.LoggingConfigurator;
import org.postfixer.compiler.Compiler;
import org.postfixer.compiler.CompilerOptions;
import org.postfixer.runtime.BackendFactory;
import org.postfixer.runtime.RuntimeOptions;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.FileNotFoundException;
import java.util.concurrent.Callable;

/**
 * Root command. Subcommands reach the shared configuration and compiler through
 * {@code @ParentCommand}.
 */
@Command(
    name = "postfixer",
    mixinStandardHelpOptions = true,
    version = "postfixer 1.0",
    description = "Parses infix expressions, prints them in postfix form and evaluates them on a stack machine.",
    subcommands = {
        ReplCommand.class,
        EvalCommand.class,
        PostfixCommand.class,
        CompileCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: ./" + ConfigLoader.DEFAULT_FILE_NAME + " if present)."
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * @return The command line, set up so that expressions such as {@code -3 + 4} are read as
     *         positional parameters rather than unknown options.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setUnmatchedOptionsArePositionalParams(true);
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging block.
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if the configuration file is missing or invalid.
     */
    public Config getConfig() {
        if (config == null) {
            try {
                config = ConfigLoader.load(configFile);
            } catch (FileNotFoundException e) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file specified via --config was not found: " + e.getMessage(), e, null, null);
            } catch (ConfigException e) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Failed to load or parse configuration: " + e.getMessage(), e, null, null);
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    /**
     * @return A compiler wired to the configured backend.
     * @throws CommandLine.ParameterException if a compiler or backend setting is invalid.
     */
    public Compiler createCompiler() {
        final Config cfg = getConfig();
        try {
            return new Compiler(CompilerOptions.fromConfig(cfg), BackendFactory.create(RuntimeOptions.fromConfig(cfg)));
        } catch (ConfigException | IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Invalid configuration: " + e.getMessage(), e, null, null);
        }
    }
}
