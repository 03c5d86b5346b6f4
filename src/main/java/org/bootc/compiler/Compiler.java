package org.bootc.compiler;

import org.bootc.compiler.api.CompilationException;
import org.bootc.compiler.api.CompilerOptions;
import org.bootc.compiler.api.ICompiler;
import org.bootc.compiler.api.InternalCompilerException;
import org.bootc.compiler.api.LexException;
import org.bootc.compiler.api.ParseException;
import org.bootc.compiler.api.TranslationArtifact;
import org.bootc.compiler.backend.emit.C99Emitter;
import org.bootc.compiler.diagnostics.CompilerLogger;
import org.bootc.compiler.frontend.lexer.Lexer;
import org.bootc.compiler.frontend.lexer.Token;
import org.bootc.compiler.frontend.parser.Parser;
import org.bootc.compiler.frontend.parser.ast.FunctionNode;

import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the pipeline from source text to
 * C99 text: lexing, parsing and emission.
 * <p>
 * Every call works on fresh stage instances and the compiler only holds immutable options,
 * so one instance may be shared.
 */
public class Compiler implements ICompiler {

    private final CompilerOptions options;

    /**
     * Creates a compiler with {@link CompilerOptions#defaults()}.
     */
    public Compiler() {
        this(CompilerOptions.defaults());
    }

    /**
     * @param options The options passed to the parser and the emitter.
     */
    public Compiler(CompilerOptions options) {
        this.options = options;
    }

    @Override
    public List<Token> tokenize(String source, String fileName) throws LexException {
        List<Token> tokens = new Lexer(source, fileName).scanTokens();
        CompilerLogger.debug("Lexer: {} produced {} tokens", fileName, tokens.size());
        return tokens;
    }

    @Override
    public FunctionNode parse(List<Token> tokens, String fileName) throws ParseException {
        FunctionNode function = new Parser(tokens, options, fileName).parseFunction();
        CompilerLogger.debug("Parser: function '{}' with {} statements", function.name(), function.body().size());
        return function;
    }

    @Override
    public String generate(FunctionNode function) throws InternalCompilerException {
        String cSource;
        try {
            cSource = new C99Emitter(options).emit(function);
        } catch (RuntimeException re) {
            throw new InternalCompilerException("Cannot generate code for function '" + function.name() + "': " + re.getMessage(), re);
        } catch (StackOverflowError soe) {
            // Only reachable for hand-built trees nested to the right; parsed chains nest to the left.
            throw new InternalCompilerException("Cannot generate code for function '" + function.name() + "': expression nested too deeply", soe);
        }
        CompilerLogger.trace("Emitter: generated C for '{}':\n{}", function.name(), cSource);
        return cSource;
    }

    @Override
    public TranslationArtifact compile(String source, String fileName) throws CompilationException {
        // Phase 1: Lexical Analysis
        List<Token> tokens = tokenize(source, fileName);

        // Phase 2: Parsing (builds AST)
        FunctionNode function = parse(tokens, fileName);

        // Phase 3: Emission
        String cSource = generate(function);

        CompilerLogger.info("Compiler: translated {} ({} bytes of C)", fileName, cSource.length());
        return new TranslationArtifact(fileName, tokens, function, cSource);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void setVerbosity(int level) {
        CompilerLogger.setLevel(level);
    }

    /**
     * @return The options this compiler was created with.
     */
    public CompilerOptions getOptions() {
        return options;
    }
}
