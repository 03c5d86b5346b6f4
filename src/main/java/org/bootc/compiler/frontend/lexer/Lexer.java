package org.bootc.compiler.frontend.lexer;

import org.bootc.compiler.api.LexException;
import org.bootc.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * An instance tokenizes exactly one source and must not be reused.
 */
public class Lexer {

    /** Identifiers that are reclassified to their own token type. */
    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "int", TokenType.INT,
            "return", TokenType.RETURN
    );

    /** File name used when the source does not come from a file. */
    public static final String DEFAULT_FILE_NAME = "<memory>";

    private final String source;
    private final String logicalFileName;
    private final List<Token> tokens = new ArrayList<>();
    private int current = 0;
    private int line = 1;
    private int column = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this(source, DEFAULT_FILE_NAME);
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param logicalFileName The name of the file being tokenized, for error reporting.
     */
    public Lexer(String source, String logicalFileName) {
        this.source = source;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, without whitespace and without an end marker.
     * @throws LexException at the first character that matches no token pattern.
     */
    public List<Token> scanTokens() throws LexException {
        Matcher matcher = TokenPattern.COMBINED.matcher(source);
        while (current < source.length()) {
            matcher.region(current, source.length());
            // MISMATCH accepts any character, so this always succeeds.
            matcher.lookingAt();
            TokenPattern pattern = matchedPattern(matcher);
            String text = matcher.group();

            switch (pattern) {
                case SKIP:
                    break;
                case MISMATCH:
                    throw new LexException(text, new SourceInfo(logicalFileName, line, column));
                default:
                    addToken(classify(pattern, text), text);
                    break;
            }
            advance(text);
        }
        return tokens;
    }

    private static TokenPattern matchedPattern(Matcher matcher) {
        for (TokenPattern pattern : TokenPattern.values()) {
            if (matcher.group(pattern.name()) != null) {
                return pattern;
            }
        }
        throw new IllegalStateException("No token pattern matched at " + matcher.regionStart());
    }

    private static TokenType classify(TokenPattern pattern, String text) {
        TokenType type = pattern.tokenType().orElseThrow();
        if (type == TokenType.ID) {
            return KEYWORDS.getOrDefault(text, TokenType.ID);
        }
        return type;
    }

    private void addToken(TokenType type, String text) {
        tokens.add(new Token(type, text, line, column, logicalFileName));
    }

    private void advance(String consumed) {
        for (int i = 0; i < consumed.length(); i++) {
            if (consumed.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        current += consumed.length();
    }
}
