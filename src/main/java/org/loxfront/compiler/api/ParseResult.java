package org.loxfront.compiler.api;

import org.loxfront.compiler.diagnostics.Diagnostic;
import org.loxfront.compiler.frontend.parser.ast.Program;

import java.util.List;

/**
 * The outcome of parsing a program. The program is a best-effort tree: statements
 * that failed to parse are missing from it.
 *
 * @param program The parsed program, never {@code null}.
 * @param errors The syntax errors in source order.
 */
public record ParseResult(Program program, List<Diagnostic> errors) {

    public ParseResult {
        errors = List.copyOf(errors);
    }

    /**
     * @return {@code true} if at least one syntax error was reported.
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
