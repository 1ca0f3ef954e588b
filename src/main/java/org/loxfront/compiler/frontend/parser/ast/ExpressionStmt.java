package org.loxfront.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An expression evaluated for its side effects, terminated by {@code ;}.
 *
 * @param expression The expression.
 */
public record ExpressionStmt(
        Expr expression
) implements Stmt {

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
