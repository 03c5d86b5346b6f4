package org.bootc.compiler.frontend.parser.ast;

/**
 * One method per {@link ExpressionNode} kind.
 * @param <R> The result type.
 */
public interface ExpressionVisitor<R> {
    R visitIntegerLiteral(IntegerLiteralNode node);

    R visitIdentifier(IdentifierNode node);

    R visitBinaryOp(BinaryOpNode node);
}
