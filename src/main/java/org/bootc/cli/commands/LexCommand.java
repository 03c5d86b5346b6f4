package org.bootc.cli.commands;

import org.bootc.cli.CommandLineInterface;
import org.bootc.compiler.Compiler;
import org.bootc.compiler.api.LexException;
import org.bootc.compiler.util.DebugDump;
import picocli.CommandLine.Command;

@Command(name = "lex", description = "Prints the token sequence of a source file.")
public class LexCommand extends AbstractSourceCommand {

    @Override
    protected int execute(Compiler compiler, String source, String fileName) throws LexException {
        out().print(DebugDump.tokens(compiler.tokenize(source, fileName)));
        out().flush();
        return CommandLineInterface.EXIT_OK;
    }
}
