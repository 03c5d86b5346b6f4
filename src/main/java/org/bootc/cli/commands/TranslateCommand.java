package org.bootc.cli.commands;

import org.bootc.cli.CommandLineInterface;
import org.bootc.compiler.Compiler;
import org.bootc.compiler.api.CompilationException;
import org.bootc.compiler.api.TranslationArtifact;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

@Command(name = "translate", description = "Translates a source file to C99 and prints or writes the result.")
public class TranslateCommand extends AbstractSourceCommand {

    @Option(names = {"-o", "--output"}, description = "Write the C99 text to this file instead of stdout.")
    private File output;

    @Override
    protected int execute(Compiler compiler, String source, String fileName) throws CompilationException, IOException {
        TranslationArtifact artifact = compiler.compile(source, fileName);
        if (output != null) {
            Files.writeString(output.toPath(), artifact.cSource(), StandardCharsets.UTF_8);
        } else {
            out().print(artifact.cSource());
            out().flush();
        }
        return CommandLineInterface.EXIT_OK;
    }
}
