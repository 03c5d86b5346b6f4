package org.bootc.compiler.frontend.parser;

import org.bootc.compiler.api.CompilerOptions;
import org.bootc.compiler.api.ParseException;
import org.bootc.compiler.frontend.lexer.Lexer;
import org.bootc.compiler.frontend.lexer.Token;
import org.bootc.compiler.frontend.lexer.TokenType;
import org.bootc.compiler.frontend.parser.ast.AssignNode;
import org.bootc.compiler.frontend.parser.ast.BinaryOpNode;
import org.bootc.compiler.frontend.parser.ast.ExpressionNode;
import org.bootc.compiler.frontend.parser.ast.FunctionNode;
import org.bootc.compiler.frontend.parser.ast.IdentifierNode;
import org.bootc.compiler.frontend.parser.ast.IntegerLiteralNode;
import org.bootc.compiler.frontend.parser.ast.Operator;
import org.bootc.compiler.frontend.parser.ast.ReturnNode;
import org.bootc.compiler.frontend.parser.ast.StatementNode;
import org.bootc.compiler.frontend.parser.ast.VarDeclNode;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A recursive-descent parser with one token of lookahead and no backtracking. It consumes a list
 * of tokens from the {@link Lexer} and produces a single
 * {@link FunctionNode}.
 * <p>
 * The first mismatch aborts parsing with a {@link ParseException}; no partial tree is returned.
 * An instance parses exactly one token list and must not be reused.
 */
public class Parser {

    private static final String ASSIGNMENT = "=";

    private final List<Token> tokens;
    private final boolean strictAssignment;
    private final String logicalFileName;
    private int current = 0;

    /**
     * Constructs a new Parser with default options.
     * @param tokens The list of tokens to parse.
     */
    public Parser(List<Token> tokens) {
        this(tokens, CompilerOptions.defaults());
    }

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse.
     * @param options The options; only {@link CompilerOptions#strictAssignment()} is used here.
     */
    public Parser(List<Token> tokens, CompilerOptions options) {
        this(tokens, options, Lexer.DEFAULT_FILE_NAME);
    }

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse.
     * @param options The options; only {@link CompilerOptions#strictAssignment()} is used here.
     * @param logicalFileName The source name, used to position the end of input when there are no tokens.
     */
    public Parser(List<Token> tokens, CompilerOptions options, String logicalFileName) {
        this.tokens = tokens;
        this.strictAssignment = options.strictAssignment();
        this.logicalFileName = logicalFileName;
    }

    /**
     * Parses {@code "int" ID "(" ")" "{" statement* "}"} followed by the end of input.
     * @return The function.
     * @throws ParseException at the first token that does not fit the grammar.
     */
    public FunctionNode parseFunction() throws ParseException {
        consume(TokenType.INT);
        String name = consume(TokenType.ID).text();
        consume(TokenType.LPAREN);
        consume(TokenType.RPAREN);
        consume(TokenType.LBRACE);
        List<StatementNode> body = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            body.add(parseStatement());
        }
        consume(TokenType.RBRACE);
        consume(TokenType.EOF);
        return new FunctionNode(name, body);
    }

    /**
     * Parses one statement, choosing the rule by the kind of the lookahead token alone.
     * @return The statement.
     * @throws ParseException if the statement is malformed.
     */
    public StatementNode parseStatement() throws ParseException {
        Token token = peek();
        switch (token.type()) {
            case RETURN: {
                advance();
                ExpressionNode expression = parseExpression();
                consume(TokenType.SEMI);
                return new ReturnNode(expression);
            }
            case INT: {
                advance();
                String name = consume(TokenType.ID).text();
                Optional<ExpressionNode> initializer = Optional.empty();
                if (check(TokenType.OP)) {
                    consumeAssignmentOperator();
                    initializer = Optional.of(parseExpression());
                }
                consume(TokenType.SEMI);
                return new VarDeclNode(name, initializer);
            }
            case ID: {
                String name = advance().text();
                consumeAssignmentOperator();
                ExpressionNode expression = parseExpression();
                consume(TokenType.SEMI);
                return new AssignNode(name, expression);
            }
            default:
                throw new ParseException(
                        "Unexpected token " + token.describe() + " at start of statement",
                        token,
                        EnumSet.of(TokenType.RETURN, TokenType.INT, TokenType.ID));
        }
    }

    /**
     * Parses {@code term (OPERATOR term)*} into a left-associative chain. All four operators
     * share one precedence level, so {@code a+b*c} becomes {@code (a+b)*c}.
     * @return The expression.
     * @throws ParseException if an operand is missing or malformed.
     */
    public ExpressionNode parseExpression() throws ParseException {
        ExpressionNode left = parseOperand();
        Optional<Operator> operator = lookaheadOperator();
        while (operator.isPresent()) {
            advance();
            ExpressionNode right = parseOperand();
            left = new BinaryOpNode(operator.get(), left, right);
            operator = lookaheadOperator();
        }
        return left;
    }

    private ExpressionNode parseOperand() throws ParseException {
        if (check(TokenType.NUMBER)) {
            return integerLiteral(advance());
        }
        if (check(TokenType.ID)) {
            return new IdentifierNode(advance().text());
        }
        Token unexpected = peek();
        throw new ParseException(
                "Expected NUMBER or ID but found " + unexpected.describe(),
                unexpected,
                EnumSet.of(TokenType.NUMBER, TokenType.ID));
    }

    private IntegerLiteralNode integerLiteral(Token number) throws ParseException {
        try {
            return new IntegerLiteralNode(Long.parseLong(number.text()));
        } catch (NumberFormatException e) {
            throw new ParseException(
                    "Integer literal out of range: " + number.text(),
                    number,
                    Set.of());
        }
    }

    private Optional<Operator> lookaheadOperator() {
        if (!check(TokenType.OP)) {
            return Optional.empty();
        }
        return Operator.fromSymbol(peek().text());
    }

    /**
     * Consumes the operator between a name and its value. Without strict assignment any
     * operator token is accepted in this position.
     */
    private void consumeAssignmentOperator() throws ParseException {
        Token operator = consume(TokenType.OP);
        if (strictAssignment && !ASSIGNMENT.equals(operator.text())) {
            throw new ParseException(
                    "Expected '" + ASSIGNMENT + "' but found " + operator.describe(),
                    operator,
                    EnumSet.of(TokenType.OP));
        }
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        Token token = peek();
        if (current < tokens.size()) {
            current++;
        }
        return token;
    }

    private Token peek() {
        if (current < tokens.size()) {
            return tokens.get(current);
        }
        return endOfInput();
    }

    private Token consume(TokenType type) throws ParseException {
        if (check(type)) {
            return advance();
        }
        Token unexpected = peek();
        throw new ParseException(
                "Expected " + type + " but found " + unexpected.describe(),
                unexpected,
                EnumSet.of(type));
    }

    private Token endOfInput() {
        if (tokens.isEmpty()) {
            return new Token(TokenType.EOF, "", 1, 1, logicalFileName);
        }
        Token last = tokens.get(tokens.size() - 1);
        return new Token(TokenType.EOF, "", last.line(), last.column() + last.text().length(), last.fileName());
    }
}
