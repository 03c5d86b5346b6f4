package org.bootc.cli.commands;

import org.bootc.cli.CommandLineInterface;
import org.bootc.compiler.Compiler;
import org.bootc.compiler.api.CompilationException;
import org.bootc.compiler.frontend.parser.ast.FunctionNode;
import org.bootc.compiler.util.DebugDump;
import picocli.CommandLine.Command;

@Command(name = "ast", description = "Prints the syntax tree of a source file.")
public class AstCommand extends AbstractSourceCommand {

    @Override
    protected int execute(Compiler compiler, String source, String fileName) throws CompilationException {
        FunctionNode function = compiler.parse(compiler.tokenize(source, fileName), fileName);
        out().print(DebugDump.ast(function));
        out().flush();
        return CommandLineInterface.EXIT_OK;
    }
}
