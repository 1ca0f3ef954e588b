package org.loxfront.compiler.frontend.lexer;

import java.util.Map;
import java.util.Optional;

/**
 * The reserved-word table. Lookups are case-sensitive: {@code var} is a keyword,
 * {@code VAR} is an identifier.
 */
public final class Keywords {

    private static final Map<String, TokenType> RESERVED = Map.ofEntries(
            Map.entry("and", TokenType.AND),
            Map.entry("class", TokenType.CLASS),
            Map.entry("else", TokenType.ELSE),
            Map.entry("false", TokenType.FALSE),
            Map.entry("for", TokenType.FOR),
            Map.entry("fun", TokenType.FUN),
            Map.entry("if", TokenType.IF),
            Map.entry("nil", TokenType.NIL),
            Map.entry("or", TokenType.OR),
            Map.entry("print", TokenType.PRINT),
            Map.entry("return", TokenType.RETURN),
            Map.entry("super", TokenType.SUPER),
            Map.entry("this", TokenType.THIS),
            Map.entry("true", TokenType.TRUE),
            Map.entry("var", TokenType.VAR),
            Map.entry("while", TokenType.WHILE)
    );

    private Keywords() {}

    /**
     * Looks up a word in the reserved-word table.
     * @param word The identifier text.
     * @return The keyword token type, or empty if the word is not reserved.
     */
    public static Optional<TokenType> lookup(String word) {
        return Optional.ofNullable(RESERVED.get(word));
    }

    /**
     * @return An unmodifiable view of the whole table.
     */
    public static Map<String, TokenType> all() {
        return RESERVED;
    }
}
