package org.loxfront.compiler.frontend.lexer;

import org.loxfront.compiler.api.CompilerErrorCode;
import org.loxfront.compiler.diagnostics.Diagnostic;
import org.loxfront.compiler.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that the lexer converts source strings into tokens, discards
 * whitespace and comments, and reports lexical errors without stopping.
 */
@Tag("unit")
public class LexerTest {

    private DiagnosticsEngine diagnostics;

    private List<Token> scan(String source) {
        diagnostics = new DiagnosticsEngine();
        return new Lexer(source, diagnostics).scanTokens();
    }

    private List<String> formatted(String source) {
        return scan(source).stream().map(Token::format).collect(Collectors.toList());
    }

    @Test
    void scansPunctuationAndSingleCharacterOperators() {
        assertThat(formatted("({*-+;.})")).containsExactly(
                "LEFT_PAREN ( null",
                "LEFT_BRACE { null",
                "STAR * null",
                "MINUS - null",
                "PLUS + null",
                "SEMICOLON ; null",
                "DOT . null",
                "RIGHT_BRACE } null",
                "RIGHT_PAREN ) null",
                "EOF  null");
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void twoCharacterOperatorsUseMaximalMunch() {
        assertThat(scan("! != = == < <= > >= !== ===").stream().map(Token::type)).containsExactly(
                TokenType.BANG, TokenType.BANG_EQUAL,
                TokenType.EQUAL, TokenType.EQUAL_EQUAL,
                TokenType.LESS, TokenType.LESS_EQUAL,
                TokenType.GREATER, TokenType.GREATER_EQUAL,
                TokenType.BANG_EQUAL, TokenType.EQUAL,
                TokenType.EQUAL_EQUAL, TokenType.EQUAL,
                TokenType.EOF);
    }

    @Test
    void slashIsDivisionUnlessDoubled() {
        List<Token> tokens = scan("a / b // the rest is ignored ( ) @\nc");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.IDENTIFIER, TokenType.SLASH, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF);
        assertThat(tokens.get(3).line()).isEqualTo(2);
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void keywordsAreCaseSensitive() {
        assertThat(formatted("var VAR fun Fun nil")).containsExactly(
                "VAR var null",
                "IDENTIFIER VAR null",
                "FUN fun null",
                "IDENTIFIER Fun null",
                "NIL nil null",
                "EOF  null");
    }

    @Test
    void everyReservedWordScansAsItsKeyword() {
        for (var entry : Keywords.all().entrySet()) {
            List<Token> tokens = scan(entry.getKey());
            assertThat(tokens).hasSize(2);
            assertThat(tokens.get(0).type()).isEqualTo(entry.getValue());
            assertThat(tokens.get(0).type().name()).isEqualTo(entry.getKey().toUpperCase());
        }
    }

    @Test
    void identifiersAllowUnderscoresAndDigits() {
        assertThat(formatted("_foo bar_2 orchid _")).containsExactly(
                "IDENTIFIER _foo null",
                "IDENTIFIER bar_2 null",
                "IDENTIFIER orchid null",
                "IDENTIFIER _ null",
                "EOF  null");
    }

    @Test
    void numbersCarryDoubleValues() {
        List<Token> tokens = scan("42 3.14 007 1234.1200");

        assertThat(tokens.get(0).value()).isEqualTo(42.0);
        assertThat(tokens.get(1).value()).isEqualTo(3.14);
        assertThat(tokens.get(2).value()).isEqualTo(7.0);
        assertThat(tokens.stream().map(Token::format)).containsExactly(
                "NUMBER 42 42.0",
                "NUMBER 3.14 3.14",
                "NUMBER 007 7.0",
                "NUMBER 1234.1200 1234.12",
                "EOF  null");
    }

    @Test
    void trailingDotIsNotPartOfNumber() {
        assertThat(formatted("12.")).containsExactly(
                "NUMBER 12 12.0",
                "DOT . null",
                "EOF  null");
        assertThat(formatted(".5")).containsExactly(
                "DOT . null",
                "NUMBER 5 5.0",
                "EOF  null");
    }

    @Test
    void stringValueExcludesQuotes() {
        List<Token> tokens = scan("\"hello // world\"");

        assertThat(tokens.get(0)).extracting(Token::type, Token::text, Token::value)
                .containsExactly(TokenType.STRING, "\"hello // world\"", "hello // world");
        assertThat(tokens.get(0).format()).isEqualTo("STRING \"hello // world\" hello // world");
    }

    @Test
    void multiLineStringAdvancesLineCounter() {
        List<Token> tokens = scan("\"a\nb\"\nx");

        assertThat(tokens.get(0).value()).isEqualTo("a\nb");
        assertThat(tokens.get(1).line()).isEqualTo(3);
    }

    @Test
    void unterminatedStringIsReportedAndProducesNoToken() {
        List<Token> tokens = scan("\"abc");

        assertThat(tokens).extracting(Token::type).containsExactly(TokenType.EOF);
        assertThat(diagnostics.getDiagnostics()).hasSize(1);
        Diagnostic error = diagnostics.getDiagnostics().get(0);
        assertThat(error.code()).isEqualTo(CompilerErrorCode.UNTERMINATED_STRING);
        assertThat(error.toString()).isEqualTo("[line 1] Error: Unterminated string.");
    }

    @Test
    void unterminatedStringIsReportedOnTheLastLine() {
        scan("print 1;\n\"abc\ndef");

        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::lineNumber).containsExactly(3);
    }

    @Test
    void unexpectedCharactersAreSkippedAndScanningContinues() {
        List<Token> tokens = scan(",.$(#\n@x");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.COMMA, TokenType.DOT, TokenType.LEFT_PAREN, TokenType.IDENTIFIER, TokenType.EOF);
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::toString).containsExactly(
                "[line 1] Error: Unexpected character: $",
                "[line 1] Error: Unexpected character: #",
                "[line 2] Error: Unexpected character: @");
        assertThat(diagnostics.getDiagnostics()).allMatch(d -> d.code() == CompilerErrorCode.UNEXPECTED_CHARACTER);
    }

    @Test
    void characterOutsideBasicPlaneIsOneError() {
        // U+1F600, a surrogate pair in UTF-16
        List<Token> tokens = scan("1 \uD83D\uDE00 2");

        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::toString)
                .containsExactly("[line 1] Error: Unexpected character: \uD83D\uDE00");
        assertThat(tokens).extracting(Token::type).containsExactly(TokenType.NUMBER, TokenType.NUMBER, TokenType.EOF);
        assertThat(tokens.get(1).column()).isEqualTo(5);
    }

    @Test
    void tracksLinesAndColumns() {
        List<Token> tokens = scan("a\n  bb >=\n\tc");

        assertThat(tokens.get(0)).extracting(Token::line, Token::column).containsExactly(1, 1);
        assertThat(tokens.get(1)).extracting(Token::line, Token::column).containsExactly(2, 3);
        assertThat(tokens.get(2)).extracting(Token::line, Token::column).containsExactly(2, 6);
        assertThat(tokens.get(3)).extracting(Token::line, Token::column).containsExactly(3, 2);
        assertThat(tokens.get(4).type()).isEqualTo(TokenType.EOF);
        assertThat(tokens.get(4).line()).isEqualTo(3);
    }

    @Test
    void lexemesReconstructSourceWithoutWhitespace() {
        String source = "var total = (price + 2.50) * count;\n"
                + "if (total >= 100) { print \"big\"; }\n";

        String joined = scan(source).stream().map(Token::text).collect(Collectors.joining());

        assertThat(joined).isEqualTo("vartotal=(price+2.50)*count;if(total>=100){print\"big\";}");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   \n\t", "// only a comment", "\"open", "@@@", "1 + 2", "a.b(c)"})
    void outputEndsWithExactlyOneEof(String source) {
        List<Token> tokens = scan(source);

        assertThat(tokens).isNotEmpty();
        assertThat(tokens.get(tokens.size() - 1).type()).isEqualTo(TokenType.EOF);
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.EOF).hasSize(1);
    }

    @Test
    void formatsLiteralsWithoutExponent() {
        assertThat(Token.formatLiteral(1e20)).isEqualTo("100000000000000000000.0");
        assertThat(Token.formatLiteral(0.0001)).isEqualTo("0.0001");
        assertThat(Token.formatLiteral(0.0)).isEqualTo("0.0");
        assertThat(Token.formatLiteral(true)).isEqualTo("true");
        assertThat(Token.formatLiteral(null)).isEqualTo("nil");
    }
}
