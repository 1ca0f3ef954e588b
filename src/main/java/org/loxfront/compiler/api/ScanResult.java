package org.loxfront.compiler.api;

import org.loxfront.compiler.diagnostics.Diagnostic;
import org.loxfront.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * The outcome of a lexical analysis pass.
 *
 * @param tokens The recognized tokens, terminated by exactly one EOF token.
 * @param errors The lexical errors in source order.
 */
public record ScanResult(List<Token> tokens, List<Diagnostic> errors) {

    public ScanResult {
        tokens = List.copyOf(tokens);
        errors = List.copyOf(errors);
    }

    /**
     * @return {@code true} if at least one lexical error was reported.
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
