package org.loxfront.compiler.diagnostics;

import org.loxfront.compiler.api.CompilerErrorCode;

/**
 * Represents a single error reported while scanning or parsing.
 *
 * @param code The classification of the error.
 * @param message The human-readable message.
 * @param lexeme The offending lexeme: {@code null} when the error is not tied to a token,
 *               an empty string when the offending token is the end of input.
 * @param lineNumber The source line of the error.
 */
public record Diagnostic(
        CompilerErrorCode code,
        String message,
        String lexeme,
        int lineNumber
) {

    /**
     * Renders the location part of the report, e.g. {@code " at 'x'"} or {@code " at end"}.
     * @return The location, or an empty string for errors without a token.
     */
    public String location() {
        if (lexeme == null) return "";
        if (lexeme.isEmpty()) return " at end";
        return " at '" + lexeme + "'";
    }

    @Override
    public String toString() {
        return String.format("[line %d] Error%s: %s", lineNumber, location(), message);
    }
}
