package org.loxfront.compiler.diagnostics;

import org.loxfront.compiler.api.CompilerErrorCode;
import org.loxfront.compiler.frontend.lexer.Token;
import org.loxfront.compiler.frontend.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * An engine for collecting diagnostic messages during a single scan or parse pass.
 * <p>
 * This decouples error reporting from the lexer and parser logic: both keep going
 * after an error and the caller decides what to do with the collected list.
 * Diagnostics are kept in the order they were reported, which is source order.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error that is not tied to a token, as the lexer does.
     *
     * @param code       The error classification.
     * @param message    The error message.
     * @param lineNumber The line number of the error.
     */
    public void reportError(CompilerErrorCode code, String message, int lineNumber) {
        diagnostics.add(new Diagnostic(code, message, null, lineNumber));
    }

    /**
     * Reports an error located at a token, as the parser does.
     *
     * @param code    The error classification.
     * @param message The error message.
     * @param token   The offending token. The end-of-input token is reported "at end".
     */
    public void reportError(CompilerErrorCode code, String message, Token token) {
        String lexeme = token.type() == TokenType.EOF ? "" : token.text();
        diagnostics.add(new Diagnostic(code, message, lexeme, token.line()));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Returns an unmodifiable view of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Merges the diagnostics of several stages into one list ordered by source line.
     * The sort is stable, so errors on the same line keep their stage order.
     *
     * @param stages The diagnostics of each stage, each already in source order.
     * @return A new list in source order.
     */
    @SafeVarargs
    public static List<Diagnostic> inSourceOrder(List<Diagnostic>... stages) {
        List<Diagnostic> merged = new ArrayList<>();
        for (List<Diagnostic> stage : stages) {
            merged.addAll(stage);
        }
        merged.sort(Comparator.comparingInt(Diagnostic::lineNumber));
        return merged;
    }
}
