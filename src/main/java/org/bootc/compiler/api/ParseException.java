package org.bootc.compiler.api;

import org.bootc.compiler.frontend.lexer.Token;
import org.bootc.compiler.frontend.lexer.TokenType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Thrown by the parser when the lookahead token does not satisfy the grammar rule in effect.
 */
public class ParseException extends CompilationException {

    private final transient Token found;
    private final Set<TokenType> expected;

    /**
     * Constructs a parse exception for a token that does not have an expected kind.
     * @param message The detail message.
     * @param found The token that was actually found.
     * @param expected The token kinds that would have been accepted. May be empty.
     */
    public ParseException(String message, Token found, Set<TokenType> expected) {
        super(ErrorKind.PARSE_ERROR, message, found.sourceInfo());
        this.found = found;
        this.expected = expected.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(expected));
    }

    /**
     * @return The token that was actually found.
     */
    public Token getFound() {
        return found;
    }

    /**
     * @return The token kinds the grammar would have accepted; empty when no single kind applies.
     */
    public Set<TokenType> getExpected() {
        return expected;
    }
}
