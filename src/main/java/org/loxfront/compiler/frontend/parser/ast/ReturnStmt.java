package org.loxfront.compiler.frontend.parser.ast;

import org.loxfront.compiler.frontend.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * A {@code return} statement.
 *
 * @param keyword The {@code return} token.
 * @param value The returned value, or {@code null}.
 */
public record ReturnStmt(
        Token keyword,
        Expr value
) implements Stmt {

    @Override
    public List<AstNode> getChildren() {
        return value == null ? Collections.emptyList() : List.of(value);
    }
}
