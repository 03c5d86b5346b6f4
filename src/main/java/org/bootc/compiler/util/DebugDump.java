package org.bootc.compiler.util;

import org.bootc.compiler.frontend.lexer.Token;
import org.bootc.compiler.frontend.parser.ast.AssignNode;
import org.bootc.compiler.frontend.parser.ast.AstNode;
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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Utility class for rendering the intermediate data of a translation as readable text.
 * The format is meant for people and may change at any time.
 */
public final class DebugDump {

	private static final String LEVEL_INDENT = "  ";
	private static final Labeler LABELER = new Labeler();

	private DebugDump() {}

	/**
	 * Dumps a token sequence, one token per line as {@code line:column KIND 'text'}.
	 * @param tokens The tokens to dump.
	 * @return The dump, ending with a newline unless the list is empty.
	 */
	public static String tokens(List<Token> tokens) {
		StringBuilder sb = new StringBuilder();
		for (Token token : tokens) {
			sb.append(token.line()).append(':').append(token.column())
					.append(' ').append(token.type())
					.append(" '").append(token.text()).append("'\n");
		}
		return sb.toString();
	}

	/**
	 * Dumps a syntax tree, one node per line, children indented below their parent.
	 * @param function The root of the tree.
	 * @return The dump, ending with a newline.
	 */
	public static String ast(FunctionNode function) {
		StringBuilder sb = new StringBuilder();
		// Explicit stack: expression chains can be nested far deeper than the call stack allows.
		Deque<Entry> pending = new ArrayDeque<>();
		pending.push(new Entry(function, 0));
		while (!pending.isEmpty()) {
			Entry entry = pending.pop();
			sb.append(LEVEL_INDENT.repeat(entry.depth())).append(label(entry.node())).append('\n');
			List<AstNode> children = entry.node().getChildren();
			for (int i = children.size() - 1; i >= 0; i--) {
				pending.push(new Entry(children.get(i), entry.depth() + 1));
			}
		}
		return sb.toString();
	}

	private record Entry(AstNode node, int depth) {}

	private static String label(AstNode node) {
		if (node instanceof FunctionNode function) return "Function " + function.name();
		if (node instanceof StatementNode statement) return statement.accept(LABELER);
		if (node instanceof ExpressionNode expression) return expression.accept(LABELER);
		return node.getClass().getSimpleName();
	}

	private static final class Labeler implements StatementVisitor<String>, ExpressionVisitor<String> {
		@Override public String visitReturn(ReturnNode node) { return "Return"; }
		@Override public String visitVarDecl(VarDeclNode node) { return "VarDecl " + node.name(); }
		@Override public String visitAssign(AssignNode node) { return "Assign " + node.name(); }
		@Override public String visitIntegerLiteral(IntegerLiteralNode node) { return "IntegerLiteral " + node.value(); }
		@Override public String visitIdentifier(IdentifierNode node) { return "Identifier " + node.name(); }
		@Override public String visitBinaryOp(BinaryOpNode node) { return "BinaryOp " + node.operator().symbol(); }
	}
}
