package org.bootc.compiler.api;

/**
 * Classifies every error that can abort a translation.
 * This decouples the test logic and the command line output from the error messages.
 */
public enum ErrorKind {
    /** A character matched no token pattern. */
    LEX_ERROR("LexError"),
    /** The lookahead token did not satisfy the grammar rule in effect. */
    PARSE_ERROR("ParseError"),
    /** The code generator met a tree it cannot render. Unreachable for trees built by the parser. */
    INTERNAL_CONSISTENCY_FAULT("InternalConsistencyFault");

    private final String displayName;

    ErrorKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return The name shown to users when a run aborts.
     */
    public String displayName() {
        return displayName;
    }
}
