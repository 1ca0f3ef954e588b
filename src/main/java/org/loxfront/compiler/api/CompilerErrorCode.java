package org.loxfront.compiler.api;

/**
 * Defines unique, testable error codes for all errors that the front end can report.
 * This decouples the test logic from the exact wording of the messages.
 */
public enum CompilerErrorCode {
    // region Lexical Errors
    /** A character that cannot start any token. */
    UNEXPECTED_CHARACTER(Category.LEXICAL),
    /** A string literal that is still open when the input ends. */
    UNTERMINATED_STRING(Category.LEXICAL),
    // endregion

    // region Syntax Errors
    /** A specific token (e.g. ')' or ';') was required but not found. */
    EXPECTED_TOKEN(Category.SYNTAX),
    /** An expression was required but the current token cannot start one. */
    EXPECTED_EXPRESSION(Category.SYNTAX),
    /** A call passes more arguments than the configured limit. */
    TOO_MANY_ARGUMENTS(Category.SYNTAX),
    /** A function declares more parameters than the configured limit. */
    TOO_MANY_PARAMETERS(Category.SYNTAX),
    /** The left-hand side of '=' is neither a variable nor a property access. */
    INVALID_ASSIGNMENT_TARGET(Category.SYNTAX);
    // endregion

    /**
     * The pipeline stage an error code belongs to.
     */
    public enum Category {
        /** Reported by the lexer. */
        LEXICAL,
        /** Reported by the parser. */
        SYNTAX
    }

    private final Category category;

    CompilerErrorCode(Category category) {
        this.category = category;
    }

    /**
     * @return The stage this error code belongs to.
     */
    public Category category() {
        return category;
    }
}
