package org.bootc.compiler.frontend.parser.ast;

import java.util.Objects;

/**
 * An AST node that represents a variable reference. The name is never resolved.
 *
 * @param name The identifier text.
 */
public record IdentifierNode(String name) implements ExpressionNode {

    public IdentifierNode {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
