package org.loxfront.compiler.api;

import org.loxfront.compiler.frontend.lexer.Token;
import org.loxfront.compiler.frontend.parser.ast.Program;

import java.util.List;

/**
 * Defines the public interface of the language front end.
 * Every operation is a pure function of its input and returns a fresh result.
 */
public interface IFrontEnd {

    /**
     * Runs lexical analysis.
     * @param source The source text.
     * @return The tokens and the lexical errors.
     */
    ScanResult scan(String source);

    /**
     * Parses a token sequence as a program.
     * @param tokens Tokens terminated by an EOF token.
     * @return The best-effort program and the syntax errors.
     */
    ParseResult parse(List<Token> tokens);

    /**
     * Parses a token sequence as a single expression.
     * @param tokens Tokens terminated by an EOF token.
     * @return The expression, if any, and the syntax errors.
     */
    ExpressionResult parseExpression(List<Token> tokens);

    /**
     * Scans and parses a source text, failing if either stage reports an error.
     * @param source The source text.
     * @return The program.
     * @throws CompilationException if any lexical or syntax error was reported.
     */
    Program compile(String source) throws CompilationException;
}
