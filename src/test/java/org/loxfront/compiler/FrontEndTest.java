package org.loxfront.compiler;

import org.loxfront.compiler.api.CompilationException;
import org.loxfront.compiler.api.CompilerErrorCode;
import org.loxfront.compiler.api.ExpressionResult;
import org.loxfront.compiler.api.FrontEndOptions;
import org.loxfront.compiler.api.ParseResult;
import org.loxfront.compiler.api.ScanResult;
import org.loxfront.compiler.diagnostics.Diagnostic;
import org.loxfront.compiler.frontend.lexer.TokenType;
import org.loxfront.compiler.frontend.parser.ast.Program;
import org.loxfront.compiler.frontend.printer.AstPrinter;
import org.loxfront.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for the {@link FrontEnd} pipeline.
 * The front end must never warn for ordinary input, which {@link LogWatchExtension} enforces.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class FrontEndTest {

    private final FrontEnd frontEnd = new FrontEnd();
    private final AstPrinter printer = new AstPrinter();

    @Test
    void scanReturnsTokensAndLexicalErrors() {
        ScanResult result = frontEnd.scan("1 $ 2");

        assertThat(result.tokens()).extracting(t -> t.type())
                .containsExactly(TokenType.NUMBER, TokenType.NUMBER, TokenType.EOF);
        assertThat(result.hasErrors()).isTrue();
        assertThat(result.errors()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.UNEXPECTED_CHARACTER);
    }

    @Test
    void parseKeepsGoodStatementsNextToBadOnes() {
        ParseResult result = frontEnd.parse(frontEnd.scan("print 1; print ; print 2;").tokens());

        assertThat(result.hasErrors()).isTrue();
        assertThat(printer.print(result.program())).isEqualTo("(print 1.0)\n(print 2.0)");
    }

    @Test
    void parseExpressionWrapsMissingTreeInOptional() {
        ExpressionResult broken = frontEnd.parseExpression(frontEnd.scan("(").tokens());
        ExpressionResult fine = frontEnd.parseExpression(frontEnd.scan("1 + 2").tokens());

        assertThat(broken.asOptional()).isEmpty();
        assertThat(broken.hasErrors()).isTrue();
        assertThat(fine.asOptional()).map(printer::print).contains("(+ 1.0 2.0)");
        assertThat(fine.hasErrors()).isFalse();
    }

    @Test
    void compileReturnsProgramForValidSource() throws CompilationException {
        Program program = frontEnd.compile("fun hello() { print \"hi\"; }\nhello();");

        assertThat(program.statements()).hasSize(2);
    }

    @Test
    void compileFailsWithAllErrorsInSourceOrder() {
        // Act
        CompilationException exception = catchThrowableOfType(
                () -> frontEnd.compile("var x = ;\n\"open"), CompilationException.class);

        // Assert
        assertThat(exception).isNotNull();
        assertThat(exception.getDiagnostics()).extracting(Diagnostic::toString).containsExactly(
                "[line 1] Error at ';': Expect expression.",
                "[line 2] Error: Unterminated string.");
        assertThat(exception.getMessage()).contains("Unterminated string.").contains("Expect expression.");
    }

    @Test
    void appliesArgumentLimitFromOptions() {
        FrontEnd strict = new FrontEnd(new FrontEndOptions(1));

        ParseResult result = strict.parse(strict.scan("f(1, 2);").tokens());

        assertThat(result.errors()).extracting(Diagnostic::code).containsExactly(CompilerErrorCode.TOO_MANY_ARGUMENTS);
    }

    @Test
    void resultsAreIndependentBetweenCalls() {
        frontEnd.scan("@");

        assertThat(frontEnd.scan("1").hasErrors()).isFalse();
    }
}
