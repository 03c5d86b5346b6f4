package org.bootc.cli.commands;

import org.bootc.cli.CommandLineInterface;
import org.bootc.compiler.Compiler;
import org.bootc.compiler.api.CompilationException;
import picocli.CommandLine;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

/**
 * Base class for subcommands that read one source file and run (part of) the pipeline on it.
 * A compilation error is printed as {@code <ErrorKind>: <message>} on stderr and nothing is
 * written to stdout.
 */
public abstract class AbstractSourceCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", paramLabel = "FILE", description = "The source file.")
    private File sourceFile;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        String source;
        try {
            source = Files.readString(sourceFile.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Cannot read " + sourceFile + ": " + e.getMessage());
            return CommandLineInterface.EXIT_FAILURE;
        }

        try {
            return execute(parent.createCompiler(), source, sourceFile.getPath());
        } catch (CompilationException e) {
            err.println(e.getKind().displayName() + ": " + e.getMessage());
            return CommandLineInterface.EXIT_COMPILATION_ERROR;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return CommandLineInterface.EXIT_FAILURE;
        }
    }

    /**
     * Runs the command on the loaded source.
     *
     * @param compiler A compiler configured from the application configuration.
     * @param source The source text.
     * @param fileName The source file name, for error positions.
     * @return The exit code.
     * @throws CompilationException if the source cannot be translated.
     * @throws IOException if writing output fails.
     */
    protected abstract int execute(Compiler compiler, String source, String fileName)
            throws CompilationException, IOException;

    protected CommandLineInterface getParent() {
        return parent;
    }

    protected File getSourceFile() {
        return sourceFile;
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }
}
