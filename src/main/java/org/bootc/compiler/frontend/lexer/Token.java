package org.bootc.compiler.frontend.lexer;

import org.bootc.compiler.api.SourceInfo;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., NUMBER, ID, OP).
 * @param text The exact text of the token from the source code. Numbers stay text here;
 *             the parser converts them.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name of the source the token comes from.
 */
public record Token(
        TokenType type,
        String text,
        int line,
        int column,
        String fileName
) {

    /**
     * @return The position of this token.
     */
    public SourceInfo sourceInfo() {
        return new SourceInfo(fileName, line, column);
    }

    /**
     * @return The token in the form used by error messages, e.g. {@code SEMI ';'}.
     */
    public String describe() {
        if (type == TokenType.EOF) {
            return "end of input";
        }
        return type + " '" + text + "'";
    }
}
