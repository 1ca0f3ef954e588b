package org.loxfront.compiler.frontend.parser.ast;

import org.loxfront.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A short-circuiting {@code and} / {@code or}. Kept apart from {@link BinaryExpr}
 * because the right operand is evaluated conditionally.
 *
 * @param left The left operand.
 * @param operator The {@code and} or {@code or} token.
 * @param right The right operand.
 */
public record LogicalExpr(
        Expr left,
        Token operator,
        Expr right
) implements Expr {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
