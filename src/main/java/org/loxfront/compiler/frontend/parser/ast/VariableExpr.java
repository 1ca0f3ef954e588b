package org.loxfront.compiler.frontend.parser.ast;

import org.loxfront.compiler.frontend.lexer.Token;

/**
 * A read of a variable.
 *
 * @param name The identifier token.
 */
public record VariableExpr(
        Token name
) implements Expr {
}
