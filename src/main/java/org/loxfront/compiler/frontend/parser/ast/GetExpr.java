package org.loxfront.compiler.frontend.parser.ast;

import org.loxfront.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A property read, {@code object.name}.
 *
 * @param object The instance expression.
 * @param name The property name.
 */
public record GetExpr(
        Expr object,
        Token name
) implements Expr {

    @Override
    public List<AstNode> getChildren() {
        return List.of(object);
    }
}
