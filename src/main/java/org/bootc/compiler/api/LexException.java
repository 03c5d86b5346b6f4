package org.bootc.compiler.api;

/**
 * Thrown by the lexer when a character matches no token pattern.
 * Tokenization stops at the first such character.
 */
public class LexException extends CompilationException {

    private final String offendingCharacter;

    /**
     * @param offendingCharacter The character that could not be tokenized.
     * @param sourceInfo Where the character was found.
     */
    public LexException(String offendingCharacter, SourceInfo sourceInfo) {
        super(ErrorKind.LEX_ERROR, "Unexpected character '" + offendingCharacter + "'", sourceInfo);
        this.offendingCharacter = offendingCharacter;
    }

    /**
     * @return The character that could not be tokenized.
     */
    public String getOffendingCharacter() {
        return offendingCharacter;
    }
}
