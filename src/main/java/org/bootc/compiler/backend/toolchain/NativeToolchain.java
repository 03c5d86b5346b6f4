package org.bootc.compiler.backend.toolchain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Turns generated C text into an executable by running an external C compiler.
 * <p>
 * The command line is {@code <command> <arguments...> <source.c> -o <executable>}.
 */
public class NativeToolchain {

    private static final Logger logger = LoggerFactory.getLogger(NativeToolchain.class);

    private final ToolchainOptions options;

    /**
     * @param options How to invoke the compiler.
     */
    public NativeToolchain(ToolchainOptions options) {
        this.options = options;
    }

    /**
     * Derives the executable name from a source file: the file name without its extension,
     * in the current working directory ({@code dir/sample.lang} becomes {@code ./sample}).
     *
     * @param sourceFile The translated source file.
     * @return The executable path.
     */
    public static Path defaultExecutableFor(Path sourceFile) {
        String fileName = sourceFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        return Paths.get(".").resolve(baseName);
    }

    /**
     * Writes the C text to a temporary file and compiles it.
     *
     * @param cSource The generated C99 text.
     * @param executable Where the binary should be written.
     * @return The result of a successful build.
     * @throws ToolchainException if the compiler cannot be run, times out, or exits with an error.
     */
    public ToolchainResult build(String cSource, Path executable) throws ToolchainException {
        Path sourceFile;
        try {
            sourceFile = Files.createTempFile("bootc-", ".c");
            Files.writeString(sourceFile, cSource, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ToolchainException("Failed to write temporary C source: " + e.getMessage(), e);
        }
        logger.debug("Created temporary source file: {}", sourceFile);

        try {
            return compile(sourceFile, executable);
        } finally {
            if (options.keepSource()) {
                logger.info("Keeping generated C source: {}", sourceFile);
            } else {
                cleanup(sourceFile);
            }
        }
    }

    private ToolchainResult compile(Path sourceFile, Path executable) throws ToolchainException {
        List<String> command = new ArrayList<>();
        command.add(options.command());
        command.addAll(options.arguments());
        command.add(sourceFile.toString());
        command.add("-o");
        command.add(executable.toString());

        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.redirectErrorStream(true);

        logger.info("Executing compiler: {}", String.join(" ", command));

        Process process;
        try {
            process = processBuilder.start();
        } catch (IOException e) {
            throw new ToolchainException("Failed to start compiler '" + options.command() + "': " + e.getMessage(), e);
        }

        // Drain output concurrently so a chatty compiler cannot block on a full pipe.
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readProcessOutput(process.getInputStream()));
        try {
            boolean finished = process.waitFor(options.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new ToolchainException("Compilation timeout of " + options.timeout() + " exceeded",
                        ToolchainException.NO_EXIT_CODE, "");
            }

            String diagnostics = output.get().trim();
            int exitCode = process.exitValue();
            logger.info("Compiler finished with exit code: {}", exitCode);

            if (exitCode != 0) {
                throw new ToolchainException("Compiler '" + options.command() + "' exited with code " + exitCode,
                        exitCode, diagnostics);
            }
            return new ToolchainResult(executable, exitCode, diagnostics);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ToolchainException("Interrupted while waiting for the compiler", e);
        } catch (ExecutionException e) {
            throw new ToolchainException("Failed to read compiler output: " + e.getCause().getMessage(), e.getCause());
        }
    }

    private static String readProcessOutput(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void cleanup(Path file) {
        try {
            Files.deleteIfExists(file);
            logger.debug("Deleted temporary file: {}", file);
        } catch (IOException e) {
            logger.warn("Failed to delete temporary file {}: {}", file, e.getMessage());
        }
    }
}
