package org.bootc.compiler.frontend.parser.ast;

/**
 * A statement inside a function body.
 */
public sealed interface StatementNode extends AstNode permits ReturnNode, VarDeclNode, AssignNode {

    /**
     * Dispatches to the visitor method for this statement kind.
     * @param visitor The visitor.
     * @param <R> The result type of the visitor.
     * @return The visitor's result.
     */
    <R> R accept(StatementVisitor<R> visitor);
}
