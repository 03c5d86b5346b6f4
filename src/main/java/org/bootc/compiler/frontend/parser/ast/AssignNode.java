package org.bootc.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * A {@code <name> = <expr>;} statement. The target is not checked against any declaration.
 *
 * @param name The assigned variable.
 * @param expression The assigned value.
 */
public record AssignNode(
        String name,
        ExpressionNode expression
) implements StatementNode {

    public AssignNode {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
