package org.loxfront.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * The root of a parsed source file.
 *
 * @param statements The top-level statements in source order.
 */
public record Program(
        List<Stmt> statements
) implements AstNode {

    public Program {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(statements);
    }
}
