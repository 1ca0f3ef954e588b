package org.loxfront.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A braced block; introduces a new scope.
 *
 * @param statements The statements of the block in source order.
 */
public record BlockStmt(
        List<Stmt> statements
) implements Stmt {

    public BlockStmt {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(statements);
    }
}
