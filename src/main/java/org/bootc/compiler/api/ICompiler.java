package org.bootc.compiler.api;

import org.bootc.compiler.frontend.lexer.Token;
import org.bootc.compiler.frontend.parser.ast.FunctionNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public, clean interface for the bootc translator.
 */
public interface ICompiler {

    /**
     * Converts source text into its token sequence.
     *
     * @param source The complete source text.
     * @param fileName A name for the source, used in error positions.
     * @return The tokens in source order. Whitespace never produces a token.
     * @throws LexException at the first character that matches no token pattern.
     */
    List<Token> tokenize(String source, String fileName) throws LexException;

    /**
     * Parses a token sequence into exactly one function.
     *
     * @param tokens The tokens produced by {@link #tokenize(String, String)}.
     * @param fileName The name given to {@link #tokenize(String, String)}, used when there are no tokens.
     * @return The root of the syntax tree.
     * @throws ParseException at the first token that does not fit the grammar.
     */
    FunctionNode parse(List<Token> tokens, String fileName) throws ParseException;

    /**
     * Renders a syntax tree as a C99 function definition.
     *
     * @param function The root of the syntax tree.
     * @return The C99 text.
     * @throws InternalCompilerException if the tree cannot be rendered.
     */
    String generate(FunctionNode function) throws InternalCompilerException;

    /**
     * Runs the whole pipeline.
     *
     * @param source The complete source text.
     * @param fileName A name for the source, used in error positions.
     * @return A {@link TranslationArtifact} containing the output of every stage.
     * @throws CompilationException if any stage fails. No partial result is produced.
     */
    TranslationArtifact compile(String source, String fileName) throws CompilationException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=error, 1=warn, 2=info, 3=debug, 4=trace).
     */
    void setVerbosity(int level);

    /**
     * Translates the source code from a file.
     * @param sourceFile The path to the source file.
     * @return A {@link TranslationArtifact} for the file.
     * @throws CompilationException if errors occur during translation.
     * @throws IOException if the file cannot be read.
     */
    default TranslationArtifact compile(Path sourceFile) throws CompilationException, IOException {
        return compile(Files.readString(sourceFile, StandardCharsets.UTF_8), sourceFile.toString());
    }
}
