package org.loxfront.compiler.frontend.parser.ast;

import org.loxfront.compiler.frontend.lexer.Token;

/**
 * A superclass method access, {@code super.method}.
 *
 * @param keyword The {@code super} token.
 * @param method The accessed method name.
 */
public record SuperExpr(
        Token keyword,
        Token method
) implements Expr {
}
