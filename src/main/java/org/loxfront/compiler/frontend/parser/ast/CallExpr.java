package org.loxfront.compiler.frontend.parser.ast;

import org.loxfront.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * A function or method call.
 *
 * @param callee The called expression.
 * @param paren The closing parenthesis, used to locate errors about the call.
 * @param arguments The arguments in source order.
 */
public record CallExpr(
        Expr callee,
        Token paren,
        List<Expr> arguments
) implements Expr {

    public CallExpr {
        arguments = List.copyOf(arguments);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(callee);
        children.addAll(arguments);
        return children;
    }
}
