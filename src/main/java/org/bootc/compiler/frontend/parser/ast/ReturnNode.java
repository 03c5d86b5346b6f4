package org.bootc.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * A {@code return <expr>;} statement.
 *
 * @param expression The returned value.
 */
public record ReturnNode(ExpressionNode expression) implements StatementNode {

    public ReturnNode {
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
