package org.bootc.compiler.backend.toolchain;

import java.nio.file.Path;

/**
 * The outcome of a successful native build.
 *
 * @param executable The produced binary.
 * @param exitCode The exit status of the compiler (always 0 here).
 * @param output Everything the compiler printed, stdout and stderr merged. Usually warnings or empty.
 */
public record ToolchainResult(Path executable, int exitCode, String output) {}
