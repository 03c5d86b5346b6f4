package org.bootc.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** A decimal integer literal. */
    NUMBER,
    /** An identifier, such as a function or variable name. */
    ID,

    // Keywords.
    /** The reserved word {@code int}. */
    INT,
    /** The reserved word {@code return}. */
    RETURN,

    // Operators and punctuation.
    /** One of {@code + - * / =}. */
    OP,
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    SEMI,

    // Miscellaneous.
    /** Synthesized by the parser past the last token. Never produced by the lexer. */
    EOF
}
