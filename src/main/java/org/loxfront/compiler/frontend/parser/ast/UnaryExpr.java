package org.loxfront.compiler.frontend.parser.ast;

import org.loxfront.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A prefix operator applied to one operand, e.g. {@code -x} or {@code !done}.
 *
 * @param operator The operator token.
 * @param right The operand.
 */
public record UnaryExpr(
        Token operator,
        Expr right
) implements Expr {

    @Override
    public List<AstNode> getChildren() {
        return List.of(right);
    }
}
