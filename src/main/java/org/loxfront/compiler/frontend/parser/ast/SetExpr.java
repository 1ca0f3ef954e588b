package org.loxfront.compiler.frontend.parser.ast;

import org.loxfront.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A property write, {@code object.name = value}.
 *
 * @param object The instance expression.
 * @param name The property name.
 * @param value The assigned value.
 */
public record SetExpr(
        Expr object,
        Token name,
        Expr value
) implements Expr {

    @Override
    public List<AstNode> getChildren() {
        return List.of(object, value);
    }
}
