package org.bootc.cli;

import ch.qos.logback.classic.Level;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.bootc.cli.commands.AstCommand;
import org.bootc.cli.commands.BuildCommand;
import org.bootc.cli.commands.LexCommand;
import org.bootc.cli.commands.TranslateCommand;
import org.bootc.compiler.Compiler;
import org.bootc.compiler.api.CompilerOptions;
import org.bootc.compiler.diagnostics.CompilerLogger;
import org.bootc.config.ConfigLoader;
import org.bootc.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "bootc",
    mixinStandardHelpOptions = true,
    version = "bootc 1.0",
    description = "bootc - translates minimal C-like programs into C99",
    subcommands = {
        TranslateCommand.class,
        BuildCommand.class,
        LexCommand.class,
        AstCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** The command succeeded. */
    public static final int EXIT_OK = 0;
    /** The source could not be translated. */
    public static final int EXIT_COMPILATION_ERROR = 1;
    /** The input could not be read, or the native toolchain failed. */
    public static final int EXIT_FAILURE = 2;

    private static final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
    private static final String BASE_LOGGER = "org.bootc";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Option(
        names = {"-v", "--verbose"},
        description = "Increase log output. Repeat for more detail (-vv)."
    )
    private boolean[] verbose = new boolean[0];

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("bootc");
        // Unhandled failures, e.g. a broken configuration file.
        commandLine.setExitCodeExceptionMapper(t -> EXIT_FAILURE);
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        try {
            this.config = ConfigLoader.load(configFile);
        } catch (ConfigException e) {
            logger.error("Failed to load or parse configuration: {}", e.getMessage());
            throw e;
        }

        LoggingConfigurator.configure(config);
        if (verbose.length > 0) {
            int level = Math.min(CompilerLogger.INFO + verbose.length, CompilerLogger.TRACE);
            CompilerLogger.setLevel(level);
            LoggingConfigurator.setLevel(BASE_LOGGER, level >= CompilerLogger.TRACE ? Level.TRACE : Level.DEBUG);
        }

        initialized = true;
    }

    /**
     * @return The merged configuration, loaded on first use.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * Creates a compiler configured from the {@code bootc.compiler} section.
     * @return A new compiler.
     */
    public Compiler createCompiler() {
        return new Compiler(CompilerOptions.fromConfig(getConfig().getConfig("bootc.compiler")));
    }
}
