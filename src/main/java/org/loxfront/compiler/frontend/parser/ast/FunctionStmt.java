package org.loxfront.compiler.frontend.parser.ast;

import org.loxfront.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * A function declaration, or a method inside a class body.
 *
 * @param name The function name.
 * @param params The parameter names.
 * @param body The statements of the function body.
 */
public record FunctionStmt(
        Token name,
        List<Token> params,
        List<Stmt> body
) implements Stmt {

    public FunctionStmt {
        params = List.copyOf(params);
        body = List.copyOf(body);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(body);
    }
}
