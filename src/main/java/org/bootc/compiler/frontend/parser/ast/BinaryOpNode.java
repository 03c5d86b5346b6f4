package org.bootc.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * A binary arithmetic operation. Chains are left-associative: in {@code a+b*c}
 * the left operand of {@code *} is the node for {@code a+b}.
 *
 * @param operator The operator.
 * @param left The left operand.
 * @param right The right operand.
 */
public record BinaryOpNode(
        Operator operator,
        ExpressionNode left,
        ExpressionNode right
) implements ExpressionNode {

    public BinaryOpNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
