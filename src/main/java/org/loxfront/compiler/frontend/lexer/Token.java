package org.loxfront.compiler.frontend.lexer;

import java.math.BigDecimal;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code (the lexeme).
 * @param value The literal payload: a {@link Double} for numbers, the unquoted content
 *              for strings, {@code null} otherwise.
 * @param line The line number where the token ends.
 * @param column The column number where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column
) {

    /**
     * Renders the token the way the {@code tokenize} command prints it,
     * e.g. {@code NUMBER 42 42.0} or {@code EOF  null}.
     * @return The token line.
     */
    public String format() {
        return type + " " + text + " " + (value == null ? "null" : formatLiteral(value));
    }

    /**
     * Formats a literal payload. Numbers always carry a fractional part and are
     * never printed in exponent notation: {@code 42.0}, {@code 1.5}, {@code 0.0001}.
     * @param value The payload, may be a Double, String or Boolean.
     * @return The printable representation; {@code nil} for {@code null}.
     */
    public static String formatLiteral(Object value) {
        if (value == null) return "nil";
        if (value instanceof Double number) {
            if (number.isNaN() || number.isInfinite()) return number.toString();
            BigDecimal decimal = BigDecimal.valueOf(number);
            if (decimal.signum() == 0) return "0.0";
            BigDecimal stripped = decimal.stripTrailingZeros();
            return stripped.scale() <= 0 ? stripped.setScale(1).toPlainString() : stripped.toPlainString();
        }
        return value.toString();
    }
}
