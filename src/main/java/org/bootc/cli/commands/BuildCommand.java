package org.bootc.cli.commands;

import org.bootc.cli.CommandLineInterface;
import org.bootc.compiler.Compiler;
import org.bootc.compiler.api.CompilationException;
import org.bootc.compiler.api.TranslationArtifact;
import org.bootc.compiler.backend.toolchain.NativeToolchain;
import org.bootc.compiler.backend.toolchain.ToolchainException;
import org.bootc.compiler.backend.toolchain.ToolchainOptions;
import org.bootc.compiler.backend.toolchain.ToolchainResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.nio.file.Path;

@Command(name = "build", description = "Translates a source file and compiles it to a native executable.")
public class BuildCommand extends AbstractSourceCommand {

    private static final Logger LOG = LoggerFactory.getLogger(BuildCommand.class);

    @Option(names = {"-o", "--output"}, description = "The executable to create (default: source name without extension, in the working directory).")
    private File output;

    @Override
    protected int execute(Compiler compiler, String source, String fileName) throws CompilationException {
        TranslationArtifact artifact = compiler.compile(source, fileName);

        ToolchainOptions options = ToolchainOptions.fromConfig(getParent().getConfig().getConfig("bootc.toolchain"));
        Path executable = output != null
                ? output.toPath()
                : NativeToolchain.defaultExecutableFor(getSourceFile().toPath());

        try {
            ToolchainResult result = new NativeToolchain(options).build(artifact.cSource(), executable);
            if (!result.output().isEmpty()) {
                err().println(result.output());
            }
            LOG.info("Built {}", result.executable());
            return CommandLineInterface.EXIT_OK;
        } catch (ToolchainException e) {
            err().println(e.getMessage());
            if (!e.getOutput().isEmpty()) {
                err().println(e.getOutput());
            }
            return CommandLineInterface.EXIT_FAILURE;
        }
    }
}
