package org.loxfront.compiler.frontend.parser.ast;

/**
 * An AST node that represents a literal value.
 *
 * @param value A {@link Double}, {@link String} or {@link Boolean}; {@code null} for {@code nil}.
 */
public record LiteralExpr(
        Object value
) implements Expr {
    // This node has no children and inherits the empty list from getChildren().
}
