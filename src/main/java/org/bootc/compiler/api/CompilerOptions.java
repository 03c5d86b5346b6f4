package org.bootc.compiler.api;

import com.typesafe.config.Config;

import java.util.Objects;

/**
 * Options that influence parsing and code generation.
 *
 * @param strictAssignment When true, only the literal {@code =} operator is accepted in
 *                         declarations and assignments. When false, any operator token is accepted
 *                         in that position.
 * @param indent The text placed in front of every statement line of the generated function.
 */
public record CompilerOptions(boolean strictAssignment, String indent) {

    private static final String STRICT_ASSIGNMENT_KEY = "strict-assignment";
    private static final String INDENT_KEY = "indent";

    /**
     * Compact constructor to ensure the indent is never null.
     */
    public CompilerOptions {
        Objects.requireNonNull(indent, "indent");
    }

    /**
     * @return The default options: permissive assignment and four spaces of indentation.
     */
    public static CompilerOptions defaults() {
        return new CompilerOptions(false, "    ");
    }

    /**
     * Reads the options from a configuration section, e.g. {@code bootc.compiler}.
     * Missing keys fall back to {@link #defaults()}.
     *
     * @param config The compiler configuration section.
     * @return The options.
     */
    public static CompilerOptions fromConfig(Config config) {
        CompilerOptions defaults = defaults();
        boolean strict = config.hasPath(STRICT_ASSIGNMENT_KEY)
                ? config.getBoolean(STRICT_ASSIGNMENT_KEY)
                : defaults.strictAssignment();
        String indent = config.hasPath(INDENT_KEY) ? config.getString(INDENT_KEY) : defaults.indent();
        return new CompilerOptions(strict, indent);
    }
}
