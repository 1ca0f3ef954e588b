package org.loxfront.compiler.frontend.parser;

import org.loxfront.compiler.api.CompilerErrorCode;
import org.loxfront.compiler.diagnostics.DiagnosticsEngine;
import org.loxfront.compiler.frontend.lexer.Token;
import org.loxfront.compiler.frontend.lexer.TokenType;
import org.loxfront.compiler.frontend.parser.ast.*;

import java.util.ArrayList;
import java.util.List;

import static org.loxfront.compiler.frontend.lexer.TokenType.*;

/**
 * A recursive-descent parser for the scripting language. It consumes a list of tokens
 * from the {@link org.loxfront.compiler.frontend.lexer.Lexer} and produces an Abstract Syntax Tree (AST).
 * <p>
 * Each precedence level has its own production. Left-associative levels are parsed as
 * loops that fold into {@link BinaryExpr} nodes, so the recursion depth follows the
 * nesting of the source, not the length of an operator chain.
 * <p>
 * Syntax errors are reported to the {@link DiagnosticsEngine}. After an error the parser
 * synchronizes on the next statement boundary and carries on, so one pass can report
 * several independent errors. A Parser instance parses its tokens once.
 */
public class Parser {

    /** The default upper bound for call arguments and function parameters. */
    public static final int DEFAULT_MAX_ARGUMENTS = 255;

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final int maxArguments;
    private int current = 0;

    /**
     * Constructs a new Parser with the default argument limit.
     * @param tokens The tokens to parse, terminated by an EOF token.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this(tokens, diagnostics, DEFAULT_MAX_ARGUMENTS);
    }

    /**
     * Constructs a new Parser.
     * @param tokens The tokens to parse, terminated by an EOF token.
     * @param diagnostics The engine for reporting errors.
     * @param maxArguments The maximum number of arguments of a call and parameters of a function.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, int maxArguments) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != EOF) {
            throw new IllegalArgumentException("Token sequence must end with an EOF token.");
        }
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.maxArguments = maxArguments;
    }

    /**
     * Parses the entire token stream as a program.
     * @return The program. Statements that failed to parse are left out.
     */
    public Program parse() {
        List<Stmt> statements = new ArrayList<>();
        while (!isAtEnd()) {
            Stmt statement = declaration();
            if (statement != null) {
                statements.add(statement);
            }
        }
        return new Program(statements);
    }

    /**
     * Parses the token stream as a single expression.
     * @return The expression, or {@code null} if it could not be parsed.
     */
    public Expr parseExpression() {
        try {
            Expr expr = expression();
            if (!isAtEnd()) {
                error(peek(), CompilerErrorCode.EXPECTED_TOKEN, "Expect end of expression.");
            }
            return expr;
        } catch (ParseError error) {
            return null;
        }
    }

    private Stmt declaration() {
        try {
            if (match(CLASS)) return classDeclaration();
            if (match(FUN)) return function("function");
            if (match(VAR)) return varDeclaration();
            return statement();
        } catch (ParseError error) {
            synchronize();
            return null;
        }
    }

    private Stmt classDeclaration() {
        Token name = consume(IDENTIFIER, "Expect class name.");

        VariableExpr superclass = null;
        if (match(LESS)) {
            consume(IDENTIFIER, "Expect superclass name.");
            superclass = new VariableExpr(previous());
        }

        consume(LEFT_BRACE, "Expect '{' before class body.");
        List<FunctionStmt> methods = new ArrayList<>();
        while (!check(RIGHT_BRACE) && !isAtEnd()) {
            methods.add(function("method"));
        }
        consume(RIGHT_BRACE, "Expect '}' after class body.");
        return new ClassStmt(name, superclass, methods);
    }

    private FunctionStmt function(String kind) {
        Token name = consume(IDENTIFIER, "Expect " + kind + " name.");
        consume(LEFT_PAREN, "Expect '(' after " + kind + " name.");
        List<Token> parameters = new ArrayList<>();
        if (!check(RIGHT_PAREN)) {
            do {
                if (parameters.size() >= maxArguments) {
                    error(peek(), CompilerErrorCode.TOO_MANY_PARAMETERS,
                            "Can't have more than " + maxArguments + " parameters.");
                }
                parameters.add(consume(IDENTIFIER, "Expect parameter name."));
            } while (match(COMMA));
        }
        consume(RIGHT_PAREN, "Expect ')' after parameters.");
        consume(LEFT_BRACE, "Expect '{' before " + kind + " body.");
        return new FunctionStmt(name, parameters, block());
    }

    private Stmt varDeclaration() {
        Token name = consume(IDENTIFIER, "Expect variable name.");
        Expr initializer = null;
        if (match(EQUAL)) {
            initializer = expression();
        }
        consume(SEMICOLON, "Expect ';' after variable declaration.");
        return new VarStmt(name, initializer);
    }

    private Stmt statement() {
        if (match(FOR)) return forStatement();
        if (match(IF)) return ifStatement();
        if (match(PRINT)) return printStatement();
        if (match(RETURN)) return returnStatement();
        if (match(WHILE)) return whileStatement();
        if (match(LEFT_BRACE)) return new BlockStmt(block());
        return expressionStatement();
    }

    private Stmt forStatement() {
        consume(LEFT_PAREN, "Expect '(' after 'for'.");

        Stmt initializer;
        if (match(SEMICOLON)) {
            initializer = null;
        } else if (match(VAR)) {
            initializer = varDeclaration();
        } else {
            initializer = expressionStatement();
        }

        Expr condition = null;
        if (!check(SEMICOLON)) {
            condition = expression();
        }
        consume(SEMICOLON, "Expect ';' after loop condition.");

        Expr increment = null;
        if (!check(RIGHT_PAREN)) {
            increment = expression();
        }
        consume(RIGHT_PAREN, "Expect ')' after for clauses.");
        Stmt body = statement();

        // for (init; cond; incr) body  ==>  { init; while (cond) { body; incr; } }
        if (increment != null) {
            body = new BlockStmt(List.of(body, new ExpressionStmt(increment)));
        }
        if (condition == null) condition = new LiteralExpr(true);
        body = new WhileStmt(condition, body);
        if (initializer != null) {
            body = new BlockStmt(List.of(initializer, body));
        }
        return body;
    }

    private Stmt ifStatement() {
        consume(LEFT_PAREN, "Expect '(' after 'if'.");
        Expr condition = expression();
        consume(RIGHT_PAREN, "Expect ')' after if condition.");

        Stmt thenBranch = statement();
        Stmt elseBranch = null;
        if (match(ELSE)) {
            elseBranch = statement();
        }
        return new IfStmt(condition, thenBranch, elseBranch);
    }

    private Stmt printStatement() {
        Expr value = expression();
        consume(SEMICOLON, "Expect ';' after value.");
        return new PrintStmt(value);
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        Expr value = null;
        if (!check(SEMICOLON)) {
            value = expression();
        }
        consume(SEMICOLON, "Expect ';' after return value.");
        return new ReturnStmt(keyword, value);
    }

    private Stmt whileStatement() {
        consume(LEFT_PAREN, "Expect '(' after 'while'.");
        Expr condition = expression();
        consume(RIGHT_PAREN, "Expect ')' after condition.");
        return new WhileStmt(condition, statement());
    }

    private List<Stmt> block() {
        List<Stmt> statements = new ArrayList<>();
        while (!check(RIGHT_BRACE) && !isAtEnd()) {
            Stmt statement = declaration();
            if (statement != null) {
                statements.add(statement);
            }
        }
        consume(RIGHT_BRACE, "Expect '}' after block.");
        return statements;
    }

    private Stmt expressionStatement() {
        Expr expr = expression();
        consume(SEMICOLON, "Expect ';' after expression.");
        return new ExpressionStmt(expr);
    }

    private Expr expression() {
        return assignment();
    }

    private Expr assignment() {
        Expr expr = or();

        if (match(EQUAL)) {
            Token equals = previous();
            // Right-associative: a = b = c assigns c to b first.
            Expr value = assignment();

            if (expr instanceof VariableExpr variable) {
                return new AssignExpr(variable.name(), value);
            } else if (expr instanceof GetExpr get) {
                return new SetExpr(get.object(), get.name(), value);
            }
            // Reported but not thrown: the parser is not confused, only the target is wrong.
            error(equals, CompilerErrorCode.INVALID_ASSIGNMENT_TARGET, "Invalid assignment target.");
        }
        return expr;
    }

    private Expr or() {
        Expr expr = and();
        while (match(OR)) {
            Token operator = previous();
            Expr right = and();
            expr = new LogicalExpr(expr, operator, right);
        }
        return expr;
    }

    private Expr and() {
        Expr expr = equality();
        while (match(AND)) {
            Token operator = previous();
            Expr right = equality();
            expr = new LogicalExpr(expr, operator, right);
        }
        return expr;
    }

    private Expr equality() {
        Expr expr = comparison();
        while (match(BANG_EQUAL, EQUAL_EQUAL)) {
            Token operator = previous();
            Expr right = comparison();
            expr = new BinaryExpr(expr, operator, right);
        }
        return expr;
    }

    private Expr comparison() {
        Expr expr = term();
        while (match(GREATER, GREATER_EQUAL, LESS, LESS_EQUAL)) {
            Token operator = previous();
            Expr right = term();
            expr = new BinaryExpr(expr, operator, right);
        }
        return expr;
    }

    private Expr term() {
        Expr expr = factor();
        while (match(MINUS, PLUS)) {
            Token operator = previous();
            Expr right = factor();
            expr = new BinaryExpr(expr, operator, right);
        }
        return expr;
    }

    private Expr factor() {
        Expr expr = unary();
        while (match(SLASH, STAR)) {
            Token operator = previous();
            Expr right = unary();
            expr = new BinaryExpr(expr, operator, right);
        }
        return expr;
    }

    private Expr unary() {
        if (match(BANG, MINUS)) {
            Token operator = previous();
            Expr right = unary();
            return new UnaryExpr(operator, right);
        }
        return call();
    }

    private Expr call() {
        Expr expr = primary();
        while (true) {
            if (match(LEFT_PAREN)) {
                expr = finishCall(expr);
            } else if (match(DOT)) {
                Token name = consume(IDENTIFIER, "Expect property name after '.'.");
                expr = new GetExpr(expr, name);
            } else {
                break;
            }
        }
        return expr;
    }

    private Expr finishCall(Expr callee) {
        List<Expr> arguments = new ArrayList<>();
        if (!check(RIGHT_PAREN)) {
            do {
                if (arguments.size() >= maxArguments) {
                    error(peek(), CompilerErrorCode.TOO_MANY_ARGUMENTS,
                            "Can't have more than " + maxArguments + " arguments.");
                }
                arguments.add(expression());
            } while (match(COMMA));
        }
        Token paren = consume(RIGHT_PAREN, "Expect ')' after arguments.");
        return new CallExpr(callee, paren, arguments);
    }

    private Expr primary() {
        if (match(FALSE)) return new LiteralExpr(false);
        if (match(TRUE)) return new LiteralExpr(true);
        if (match(NIL)) return new LiteralExpr(null);

        if (match(NUMBER, STRING)) {
            return new LiteralExpr(previous().value());
        }

        if (match(SUPER)) {
            Token keyword = previous();
            consume(DOT, "Expect '.' after 'super'.");
            Token method = consume(IDENTIFIER, "Expect superclass method name.");
            return new SuperExpr(keyword, method);
        }

        if (match(THIS)) return new ThisExpr(previous());

        if (match(IDENTIFIER)) return new VariableExpr(previous());

        if (match(LEFT_PAREN)) {
            Expr expr = expression();
            consume(RIGHT_PAREN, "Expect ')' after expression.");
            return new GroupingExpr(expr);
        }

        throw error(peek(), CompilerErrorCode.EXPECTED_EXPRESSION, "Expect expression.");
    }

    /**
     * Discards tokens until a statement boundary: just after a ';' or right before
     * a keyword that starts a new statement.
     */
    private void synchronize() {
        advance();
        while (!isAtEnd()) {
            if (previous().type() == SEMICOLON) return;
            switch (peek().type()) {
                case CLASS, FUN, VAR, FOR, IF, WHILE, PRINT, RETURN:
                    return;
                default:
                    advance();
            }
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == EOF;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(peek(), CompilerErrorCode.EXPECTED_TOKEN, errorMessage);
    }

    private ParseError error(Token token, CompilerErrorCode code, String message) {
        diagnostics.reportError(code, message, token);
        return new ParseError(message);
    }

    /**
     * Unwinds the recursive descent to the nearest synchronization point.
     * The error itself has already been reported when this is thrown.
     */
    private static final class ParseError extends RuntimeException {
        ParseError(String message) {
            super(message, null, false, false);
        }
    }
}
