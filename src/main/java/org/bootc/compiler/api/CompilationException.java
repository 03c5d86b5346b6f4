package org.bootc.compiler.api;

import java.util.Optional;

/**
 * An exception that is thrown when an error aborts the translation process.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 * The first error is always fatal, so an instance describes exactly one fault.
 */
public class CompilationException extends Exception {

    private final ErrorKind kind;
    private final transient SourceInfo sourceInfo;

    /**
     * Constructs a new compilation exception without a source position.
     * @param kind The kind of error.
     * @param message The detail message.
     * @param cause The cause, may be null.
     */
    public CompilationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.sourceInfo = null;
    }

    /**
     * Constructs a new compilation exception with the specified source information.
     * @param kind The kind of error.
     * @param message The detail message.
     * @param sourceInfo The position of the offending input.
     */
    public CompilationException(ErrorKind kind, String message, SourceInfo sourceInfo) {
        super(String.format("%s at %s", message, sourceInfo), null);
        this.kind = kind;
        this.sourceInfo = sourceInfo;
    }

    /**
     * @return The kind of this error.
     */
    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return The position of the offending input, if known.
     */
    public Optional<SourceInfo> getSourceInfo() {
        return Optional.ofNullable(sourceInfo);
    }
}
