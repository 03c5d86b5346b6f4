package org.bootc.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * The root of every syntax tree: a parameterless function returning {@code int}.
 *
 * @param name The function name.
 * @param body The statements of the function body, in source order.
 */
public record FunctionNode(
        String name,
        List<StatementNode> body
) implements AstNode {

    public FunctionNode {
        Objects.requireNonNull(name, "name");
        body = List.copyOf(body);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(body);
    }
}
