package org.bootc.compiler.backend.toolchain;

import com.typesafe.config.Config;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * How the native C compiler is invoked.
 *
 * @param command The compiler executable, e.g. {@code gcc}.
 * @param arguments Extra arguments placed before the source file.
 * @param timeout How long to wait for the compiler before killing it.
 * @param keepSource When true, the temporary C file is left on disk.
 */
public record ToolchainOptions(
        String command,
        List<String> arguments,
        Duration timeout,
        boolean keepSource
) {
    private static final String COMMAND_KEY = "command";
    private static final String ARGUMENTS_KEY = "arguments";
    private static final String TIMEOUT_KEY = "timeout";
    private static final String KEEP_SOURCE_KEY = "keep-source";

    public ToolchainOptions {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");
        arguments = List.copyOf(arguments);
    }

    /**
     * @return {@code gcc} without extra arguments, a 60 second timeout, temporary file removed.
     */
    public static ToolchainOptions defaults() {
        return new ToolchainOptions("gcc", List.of(), Duration.ofSeconds(60), false);
    }

    /**
     * Reads the options from a configuration section, e.g. {@code bootc.toolchain}.
     * Missing keys fall back to {@link #defaults()}.
     *
     * @param config The toolchain configuration section.
     * @return The options.
     */
    public static ToolchainOptions fromConfig(Config config) {
        ToolchainOptions defaults = defaults();
        return new ToolchainOptions(
                config.hasPath(COMMAND_KEY) ? config.getString(COMMAND_KEY) : defaults.command(),
                config.hasPath(ARGUMENTS_KEY) ? config.getStringList(ARGUMENTS_KEY) : defaults.arguments(),
                config.hasPath(TIMEOUT_KEY) ? config.getDuration(TIMEOUT_KEY) : defaults.timeout(),
                config.hasPath(KEEP_SOURCE_KEY) ? config.getBoolean(KEEP_SOURCE_KEY) : defaults.keepSource());
    }
}
