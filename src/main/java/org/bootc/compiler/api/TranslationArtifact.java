package org.bootc.compiler.api;

import org.bootc.compiler.frontend.lexer.Token;
import org.bootc.compiler.frontend.parser.ast.FunctionNode;

import java.util.List;

/**
 * The result of a successful translation. Holds the output of every pipeline stage.
 *
 * @param fileName The name of the translated source, used for diagnostics.
 * @param tokens The token sequence produced by the lexer.
 * @param function The root of the syntax tree.
 * @param cSource The generated C99 function definition.
 */
public record TranslationArtifact(
        String fileName,
        List<Token> tokens,
        FunctionNode function,
        String cSource
) {
    public TranslationArtifact {
        tokens = List.copyOf(tokens);
    }
}
