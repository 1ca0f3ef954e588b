package org.loxfront.compiler.frontend.parser.ast;

import org.loxfront.compiler.frontend.lexer.Token;

/**
 * The {@code this} keyword inside a method.
 *
 * @param keyword The {@code this} token.
 */
public record ThisExpr(
        Token keyword
) implements Expr {
}
