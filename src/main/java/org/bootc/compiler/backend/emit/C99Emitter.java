package org.bootc.compiler.backend.emit;

import org.bootc.compiler.api.CompilerOptions;
import org.bootc.compiler.frontend.parser.ast.AssignNode;
import org.bootc.compiler.frontend.parser.ast.BinaryOpNode;
import org.bootc.compiler.frontend.parser.ast.ExpressionNode;
import org.bootc.compiler.frontend.parser.ast.ExpressionVisitor;
import org.bootc.compiler.frontend.parser.ast.FunctionNode;
import org.bootc.compiler.frontend.parser.ast.IdentifierNode;
import org.bootc.compiler.frontend.parser.ast.IntegerLiteralNode;
import org.bootc.compiler.frontend.parser.ast.ReturnNode;
import org.bootc.compiler.frontend.parser.ast.StatementNode;
import org.bootc.compiler.frontend.parser.ast.StatementVisitor;
import org.bootc.compiler.frontend.parser.ast.VarDeclNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a syntax tree as C99 source text.
 * <p>
 * A binary operand that is itself a binary operation is wrapped in parentheses, so the
 * left-to-right grouping of the source survives C's own operator precedence.
 * The emitter keeps no state between calls.
 */
public class C99Emitter implements StatementVisitor<String>, ExpressionVisitor<String> {

    private final String indent;

    /**
     * Creates an emitter with the default indentation.
     */
    public C99Emitter() {
        this(CompilerOptions.defaults());
    }

    /**
     * @param options The options; only {@link CompilerOptions#indent()} is used here.
     */
    public C99Emitter(CompilerOptions options) {
        this.indent = options.indent();
    }

    /**
     * Emits a complete function definition.
     * @param function The root of the syntax tree.
     * @return {@code int <name>(void) {...}} followed by a newline.
     */
    public String emit(FunctionNode function) {
        StringBuilder sb = new StringBuilder();
        sb.append("int ").append(function.name()).append("(void) {\n");
        for (StatementNode statement : function.body()) {
            sb.append(indent).append(statement.accept(this)).append('\n');
        }
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * Emits a single statement, without indentation or line break.
     * @param statement The statement.
     * @return The C text of the statement.
     */
    public String emit(StatementNode statement) {
        return statement.accept(this);
    }

    /**
     * Emits a single expression.
     * @param expression The expression.
     * @return The C text of the expression.
     */
    public String emit(ExpressionNode expression) {
        return expression.accept(this);
    }

    @Override
    public String visitReturn(ReturnNode node) {
        return "return " + emit(node.expression()) + ";";
    }

    @Override
    public String visitVarDecl(VarDeclNode node) {
        return node.initializer()
                .map(init -> "int " + node.name() + " = " + emit(init) + ";")
                .orElseGet(() -> "int " + node.name() + ";");
    }

    @Override
    public String visitAssign(AssignNode node) {
        return node.name() + " = " + emit(node.expression()) + ";";
    }

    @Override
    public String visitIntegerLiteral(IntegerLiteralNode node) {
        return Long.toString(node.value());
    }

    @Override
    public String visitIdentifier(IdentifierNode node) {
        return node.name();
    }

    @Override
    public String visitBinaryOp(BinaryOpNode node) {
        // Chains grow to the left, so the left spine is walked in a loop.
        List<BinaryOpNode> spine = new ArrayList<>();
        ExpressionNode leftmost = node;
        while (leftmost instanceof BinaryOpNode binary) {
            spine.add(binary);
            leftmost = binary.left();
        }

        StringBuilder sb = new StringBuilder();
        sb.append("(".repeat(spine.size() - 1)).append(emit(leftmost));
        for (int i = spine.size() - 1; i >= 0; i--) {
            BinaryOpNode current = spine.get(i);
            if (i < spine.size() - 1) {
                sb.append(')');
            }
            sb.append(' ').append(current.operator().symbol()).append(' ').append(operand(current.right()));
        }
        return sb.toString();
    }

    private String operand(ExpressionNode operand) {
        if (operand instanceof BinaryOpNode) {
            return "(" + emit(operand) + ")";
        }
        return emit(operand);
    }
}
