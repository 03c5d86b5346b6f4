package org.bootc.compiler.api;

/**
 * Signals that the code generator met a tree it cannot render.
 * Trees produced by the parser never trigger it.
 */
public class InternalCompilerException extends CompilationException {

    /**
     * @param message The detail message.
     * @param cause The failure raised while rendering.
     */
    public InternalCompilerException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL_CONSISTENCY_FAULT, message, cause);
    }
}
