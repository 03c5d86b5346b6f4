package org.bootc.compiler.frontend.parser.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * The arithmetic operators. All share one precedence level.
 */
public enum Operator {
    PLUS("+"),
    MINUS("-"),
    MULTIPLY("*"),
    DIVIDE("/");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return The source and C spelling of the operator.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Looks up an operator by its spelling.
     * @param symbol The operator text, e.g. {@code "+"}.
     * @return The operator, or empty for anything else (including {@code "="}).
     */
    public static Optional<Operator> fromSymbol(String symbol) {
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(symbol))
                .findFirst();
    }
}
