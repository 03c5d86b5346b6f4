package org.bootc.compiler.frontend.parser.ast;

/**
 * An expression: a literal, a name, or a binary operation over two expressions.
 */
public sealed interface ExpressionNode extends AstNode permits IntegerLiteralNode, IdentifierNode, BinaryOpNode {

    /**
     * Dispatches to the visitor method for this expression kind.
     * @param visitor The visitor.
     * @param <R> The result type of the visitor.
     * @return The visitor's result.
     */
    <R> R accept(ExpressionVisitor<R> visitor);
}
