package org.loxfront.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 * The constant names are also the names printed by the {@code tokenize} command.
 */
public enum TokenType {
    // Single-character tokens.
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACE,
    RIGHT_BRACE,
    COMMA,
    DOT,
    MINUS,
    PLUS,
    SEMICOLON,
    SLASH,
    STAR,

    // One or two character tokens.
    BANG,
    BANG_EQUAL,
    EQUAL,
    EQUAL_EQUAL,
    GREATER,
    GREATER_EQUAL,
    LESS,
    LESS_EQUAL,

    // Literals.
    /** A user-defined name. */
    IDENTIFIER,
    /** A string literal; the token value is the content without quotes. */
    STRING,
    /** A numeric literal; the token value is a {@link Double}. */
    NUMBER,

    // Keywords, see Keywords for the reserved-word table.
    AND,
    CLASS,
    ELSE,
    FALSE,
    FUN,
    FOR,
    IF,
    NIL,
    OR,
    PRINT,
    RETURN,
    SUPER,
    THIS,
    TRUE,
    VAR,
    WHILE,

    /** Represents the end of the source. Always the last token of a sequence. */
    EOF
}
