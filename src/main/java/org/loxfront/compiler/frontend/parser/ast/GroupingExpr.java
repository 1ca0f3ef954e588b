package org.loxfront.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A parenthesized expression.
 *
 * @param expression The inner expression.
 */
public record GroupingExpr(
        Expr expression
) implements Expr {

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
