package org.bootc.compiler.backend.emit;

import org.bootc.compiler.api.CompilerOptions;
import org.bootc.compiler.frontend.parser.ast.AssignNode;
import org.bootc.compiler.frontend.parser.ast.BinaryOpNode;
import org.bootc.compiler.frontend.parser.ast.ExpressionNode;
import org.bootc.compiler.frontend.parser.ast.FunctionNode;
import org.bootc.compiler.frontend.parser.ast.IdentifierNode;
import org.bootc.compiler.frontend.parser.ast.IntegerLiteralNode;
import org.bootc.compiler.frontend.parser.ast.Operator;
import org.bootc.compiler.frontend.parser.ast.ReturnNode;
import org.bootc.compiler.frontend.parser.ast.VarDeclNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link C99Emitter}.
 * The trees are built by hand, so these tests do not depend on the lexer or parser.
 */
public class C99EmitterTest {

    private final C99Emitter emitter = new C99Emitter();

    private static IntegerLiteralNode num(long value) {
        return new IntegerLiteralNode(value);
    }

    private static IdentifierNode id(String name) {
        return new IdentifierNode(name);
    }

    @Test
    @Tag("unit")
    void testLeafExpressions() {
        assertThat(emitter.emit(num(42))).isEqualTo("42");
        assertThat(emitter.emit(num(0))).isEqualTo("0");
        assertThat(emitter.emit(id("counter"))).isEqualTo("counter");
    }

    @Test
    @Tag("unit")
    void testFlatBinaryOperationHasNoParentheses() {
        assertThat(emitter.emit(new BinaryOpNode(Operator.PLUS, num(1), num(2)))).isEqualTo("1 + 2");
        assertThat(emitter.emit(new BinaryOpNode(Operator.DIVIDE, id("a"), num(2)))).isEqualTo("a / 2");
    }

    /**
     * A nested operation is parenthesized so that C evaluates it first, which keeps
     * {@code a+b*c} meaning {@code (a+b)*c}.
     */
    @Test
    @Tag("unit")
    void testNestedOperandIsParenthesized() {
        BinaryOpNode sumTimesC = new BinaryOpNode(Operator.MULTIPLY,
                new BinaryOpNode(Operator.PLUS, id("a"), id("b")),
                id("c"));

        assertThat(emitter.emit(sumTimesC)).isEqualTo("(a + b) * c");
    }

    @Test
    @Tag("unit")
    void testLeftAssociativeChain() {
        BinaryOpNode chain = new BinaryOpNode(Operator.MINUS,
                new BinaryOpNode(Operator.MINUS,
                        new BinaryOpNode(Operator.PLUS, num(1), num(2)),
                        num(3)),
                num(4));

        assertThat(emitter.emit(chain)).isEqualTo("((1 + 2) - 3) - 4");
    }

    @Test
    @Tag("unit")
    void testRightOperandIsParenthesizedToo() {
        BinaryOpNode node = new BinaryOpNode(Operator.MINUS, num(1),
                new BinaryOpNode(Operator.MINUS, num(2), num(3)));

        assertThat(emitter.emit(node)).isEqualTo("1 - (2 - 3)");
    }

    @Test
    @Tag("unit")
    void testWideLiteralIsWrittenAsIs() {
        assertThat(emitter.emit(num(3_000_000_000L))).isEqualTo("3000000000");
    }

    /**
     * Chains built by the parser only nest to the left and can be arbitrarily long.
     */
    @Test
    @Tag("unit")
    void testVeryLongLeftChainDoesNotExhaustTheStack() {
        int operators = 150_000;
        ExpressionNode chain = num(1);
        for (int i = 0; i < operators; i++) {
            chain = new BinaryOpNode(Operator.PLUS, chain, num(1));
        }

        String text = emitter.emit(chain);

        assertThat(text).hasSize((operators - 1) + "1".length() + operators * " + 1".length() + (operators - 1));
        assertThat(text).startsWith("((((").endsWith(") + 1) + 1");
        assertThat(text.substring(operators - 1, operators - 1 + "1 + 1) + 1".length())).isEqualTo("1 + 1) + 1");
    }

    @Test
    @Tag("unit")
    void testStatements() {
        assertThat(emitter.emit(new ReturnNode(num(0)))).isEqualTo("return 0;");
        assertThat(emitter.emit(new VarDeclNode("x"))).isEqualTo("int x;");
        assertThat(emitter.emit(new VarDeclNode("x", num(5)))).isEqualTo("int x = 5;");
        assertThat(emitter.emit(new AssignNode("x", new BinaryOpNode(Operator.MULTIPLY, id("x"), num(2)))))
                .isEqualTo("x = x * 2;");
    }

    @Test
    @Tag("unit")
    void testFunction() {
        FunctionNode function = new FunctionNode("main", List.of(
                new VarDeclNode("x"),
                new AssignNode("x", num(5)),
                new ReturnNode(id("x"))));

        assertThat(emitter.emit(function)).isEqualTo(
                "int main(void) {\n"
                + "    int x;\n"
                + "    x = 5;\n"
                + "    return x;\n"
                + "}\n");
    }

    @Test
    @Tag("unit")
    void testEmptyFunction() {
        assertThat(emitter.emit(new FunctionNode("f", List.of()))).isEqualTo("int f(void) {\n}\n");
    }

    @Test
    @Tag("unit")
    void testConfiguredIndent() {
        C99Emitter tabs = new C99Emitter(new CompilerOptions(false, "\t"));

        assertThat(tabs.emit(new FunctionNode("f", List.of(new ReturnNode(num(1))))))
                .isEqualTo("int f(void) {\n\treturn 1;\n}\n");
    }
}
