package org.loxfront.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A conditional statement. A dangling {@code else} binds to the nearest {@code if}.
 *
 * @param condition The condition.
 * @param thenBranch The statement executed when the condition holds.
 * @param elseBranch The alternative, or {@code null}.
 */
public record IfStmt(
        Expr condition,
        Stmt thenBranch,
        Stmt elseBranch
) implements Stmt {

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(condition);
        children.add(thenBranch);
        if (elseBranch != null) children.add(elseBranch);
        return children;
    }
}
