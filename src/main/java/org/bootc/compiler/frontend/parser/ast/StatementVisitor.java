package org.bootc.compiler.frontend.parser.ast;

/**
 * One method per {@link StatementNode} kind.
 * @param <R> The result type.
 */
public interface StatementVisitor<R> {
    R visitReturn(ReturnNode node);

    R visitVarDecl(VarDeclNode node);

    R visitAssign(AssignNode node);
}
