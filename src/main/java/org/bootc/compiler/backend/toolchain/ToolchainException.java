package org.bootc.compiler.backend.toolchain;

/**
 * Thrown when the native compiler cannot be started, times out, or reports failure.
 */
public class ToolchainException extends Exception {

    /** Exit code used when the compiler never produced one. */
    public static final int NO_EXIT_CODE = -1;

    private final int exitCode;
    private final String output;

    /**
     * Constructs an exception for a compiler run that finished with an error status.
     * @param message The detail message.
     * @param exitCode The exit status of the compiler.
     * @param output The compiler diagnostics.
     */
    public ToolchainException(String message, int exitCode, String output) {
        super(message);
        this.exitCode = exitCode;
        this.output = output;
    }

    /**
     * Constructs an exception for a compiler run that could not complete.
     * @param message The detail message.
     * @param cause The cause.
     */
    public ToolchainException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = NO_EXIT_CODE;
        this.output = "";
    }

    /**
     * @return The exit status of the compiler, or {@link #NO_EXIT_CODE}.
     */
    public int getExitCode() {
        return exitCode;
    }

    /**
     * @return The compiler diagnostics, possibly empty.
     */
    public String getOutput() {
        return output;
    }
}
