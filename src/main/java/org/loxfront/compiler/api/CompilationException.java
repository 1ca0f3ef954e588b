package org.loxfront.compiler.api;

import org.loxfront.compiler.diagnostics.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An exception that is thrown when one or more errors occur during scanning or parsing.
 * <p>
 * It is part of the public API and is the gate between the front end and any later stage:
 * a program is only handed on when no error was reported.
 */
public class CompilationException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * Constructs a new compilation exception from the collected diagnostics.
     * @param diagnostics The errors in source order; must not be empty.
     */
    public CompilationException(List<Diagnostic> diagnostics) {
        super(diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n")));
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The errors that caused the failure, in source order.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
