package org.loxfront.compiler.frontend.parser.ast;

import org.loxfront.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An assignment to a variable.
 *
 * @param name The assigned variable.
 * @param value The new value.
 */
public record AssignExpr(
        Token name,
        Expr value
) implements Expr {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }
}
