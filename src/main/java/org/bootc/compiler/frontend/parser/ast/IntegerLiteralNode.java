package org.bootc.compiler.frontend.parser.ast;

/**
 * An AST node that represents an integer literal.
 *
 * @param value The value of the literal. Any decimal literal up to {@link Long#MAX_VALUE} is kept.
 */
public record IntegerLiteralNode(long value) implements ExpressionNode {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIntegerLiteral(this);
    }

    // This node has no children and inherits the empty list from getChildren().
}
