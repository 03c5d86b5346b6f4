package org.bootc.compiler.frontend.lexer;

import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The ordered table of token patterns. At every position the patterns are tried in declaration
 * order and the first one that matches wins, even if a later one would match more text.
 */
public enum TokenPattern {
    NUMBER("\\d+", TokenType.NUMBER),
    ID("[A-Za-z_]\\w*", TokenType.ID),
    OP("[+\\-*/=]", TokenType.OP),
    LPAREN("\\(", TokenType.LPAREN),
    RPAREN("\\)", TokenType.RPAREN),
    LBRACE("\\{", TokenType.LBRACE),
    RBRACE("\\}", TokenType.RBRACE),
    SEMI(";", TokenType.SEMI),
    /** Whitespace. Matched and dropped. */
    SKIP("[ \\t\\r\\n]+", null),
    /** Any single character the patterns above do not cover. */
    MISMATCH(".", null);

    /** All patterns as one alternation of named groups, in table order. */
    static final Pattern COMBINED = Pattern.compile(
            Arrays.stream(values())
                    .map(p -> "(?<" + p.name() + ">" + p.regex + ")")
                    .collect(Collectors.joining("|")),
            Pattern.DOTALL);

    private final String regex;
    private final TokenType tokenType;

    TokenPattern(String regex, TokenType tokenType) {
        this.regex = regex;
        this.tokenType = tokenType;
    }

    /**
     * @return The regular expression of this pattern.
     */
    public String regex() {
        return regex;
    }

    /**
     * @return The token type produced by this pattern, or empty for {@link #SKIP} and {@link #MISMATCH}.
     */
    public Optional<TokenType> tokenType() {
        return Optional.ofNullable(tokenType);
    }
}
