package org.loxfront.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A {@code print} statement.
 *
 * @param expression The printed expression.
 */
public record PrintStmt(
        Expr expression
) implements Stmt {

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }
}
