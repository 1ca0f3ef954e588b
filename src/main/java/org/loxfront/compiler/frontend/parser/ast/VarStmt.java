package org.loxfront.compiler.frontend.parser.ast;

import org.loxfront.compiler.frontend.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * A variable declaration.
 *
 * @param name The declared name.
 * @param initializer The initial value, or {@code null} when the declaration has none.
 */
public record VarStmt(
        Token name,
        Expr initializer
) implements Stmt {

    @Override
    public List<AstNode> getChildren() {
        return initializer == null ? Collections.emptyList() : List.of(initializer);
    }
}
