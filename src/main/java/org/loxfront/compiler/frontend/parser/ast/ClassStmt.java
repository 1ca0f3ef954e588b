package org.loxfront.compiler.frontend.parser.ast;

import org.loxfront.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * A class declaration.
 *
 * @param name The class name.
 * @param superclass The superclass reference, or {@code null}.
 * @param methods The methods in declaration order.
 */
public record ClassStmt(
        Token name,
        VariableExpr superclass,
        List<FunctionStmt> methods
) implements Stmt {

    public ClassStmt {
        methods = List.copyOf(methods);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        if (superclass != null) children.add(superclass);
        children.addAll(methods);
        return children;
    }
}
