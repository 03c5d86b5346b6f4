package org.bootc.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An {@code int <name>;} or {@code int <name> = <expr>;} declaration.
 *
 * @param name The declared variable.
 * @param initializer The initial value, if one was given.
 */
public record VarDeclNode(
        String name,
        Optional<ExpressionNode> initializer
) implements StatementNode {

    public VarDeclNode {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(initializer, "initializer");
    }

    /**
     * Constructor for a declaration without initializer.
     * @param name The declared variable.
     */
    public VarDeclNode(String name) {
        this(name, Optional.empty());
    }

    /**
     * Constructor for a declaration with initializer.
     * @param name The declared variable.
     * @param initializer The initial value.
     */
    public VarDeclNode(String name, ExpressionNode initializer) {
        this(name, Optional.of(initializer));
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitVarDecl(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return initializer.<List<AstNode>>map(List::of).orElse(List.of());
    }
}
