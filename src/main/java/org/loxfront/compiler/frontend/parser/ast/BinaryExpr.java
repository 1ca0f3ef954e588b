package org.loxfront.compiler.frontend.parser.ast;

import org.loxfront.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An arithmetic, comparison or equality operation.
 *
 * @param left The left operand.
 * @param operator The operator token.
 * @param right The right operand.
 */
public record BinaryExpr(
        Expr left,
        Token operator,
        Expr right
) implements Expr {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
