package org.loxfront.compiler.api;

import org.loxfront.compiler.diagnostics.Diagnostic;
import org.loxfront.compiler.frontend.parser.ast.Expr;

import java.util.List;
import java.util.Optional;

/**
 * The outcome of parsing a single expression.
 *
 * @param expression The expression, or {@code null} when it could not be parsed.
 * @param errors The syntax errors in source order.
 */
public record ExpressionResult(Expr expression, List<Diagnostic> errors) {

    public ExpressionResult {
        errors = List.copyOf(errors);
    }

    /**
     * @return The expression, if one was parsed.
     */
    public Optional<Expr> asOptional() {
        return Optional.ofNullable(expression);
    }

    /**
     * @return {@code true} if at least one syntax error was reported.
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
