package org.loxfront.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A {@code while} loop. {@code for} loops are desugared into this node.
 *
 * @param condition The loop condition.
 * @param body The loop body.
 */
public record WhileStmt(
        Expr condition,
        Stmt body
) implements Stmt {

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, body);
    }
}
