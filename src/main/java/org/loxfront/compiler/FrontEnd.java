package org.loxfront.compiler;

import org.loxfront.compiler.api.CompilationException;
import org.loxfront.compiler.api.ExpressionResult;
import org.loxfront.compiler.api.FrontEndOptions;
import org.loxfront.compiler.api.IFrontEnd;
import org.loxfront.compiler.api.ParseResult;
import org.loxfront.compiler.api.ScanResult;
import org.loxfront.compiler.diagnostics.Diagnostic;
import org.loxfront.compiler.diagnostics.DiagnosticsEngine;
import org.loxfront.compiler.frontend.TreeWalker;
import org.loxfront.compiler.frontend.lexer.Lexer;
import org.loxfront.compiler.frontend.lexer.Token;
import org.loxfront.compiler.frontend.parser.Parser;
import org.loxfront.compiler.frontend.parser.ast.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The front end implementation. This class orchestrates the pipeline from
 * source text to a syntax tree. Each call uses its own {@link DiagnosticsEngine},
 * so one instance can be shared between threads.
 */
public class FrontEnd implements IFrontEnd {

    private static final Logger LOG = LoggerFactory.getLogger(FrontEnd.class);

    private final FrontEndOptions options;

    /**
     * Creates a front end with default options.
     */
    public FrontEnd() {
        this(FrontEndOptions.defaults());
    }

    /**
     * Creates a front end.
     * @param options The limits to apply while parsing.
     */
    public FrontEnd(FrontEndOptions options) {
        this.options = options;
    }

    @Override
    public ScanResult scan(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();
        LOG.debug("Scanned {} tokens with {} lexical errors", tokens.size(), diagnostics.getDiagnostics().size());
        return new ScanResult(tokens, diagnostics.getDiagnostics());
    }

    @Override
    public ParseResult parse(List<Token> tokens) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Program program = new Parser(tokens, diagnostics, options.maxArguments()).parse();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Parsed {} statements ({} nodes) with {} syntax errors",
                    program.statements().size(), TreeWalker.countNodes(program), diagnostics.getDiagnostics().size());
        }
        return new ParseResult(program, diagnostics.getDiagnostics());
    }

    @Override
    public ExpressionResult parseExpression(List<Token> tokens) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        ExpressionResult result = new ExpressionResult(
                new Parser(tokens, diagnostics, options.maxArguments()).parseExpression(),
                diagnostics.getDiagnostics());
        LOG.debug("Parsed expression with {} syntax errors", result.errors().size());
        return result;
    }

    @Override
    public Program compile(String source) throws CompilationException {
        ScanResult scanned = scan(source);
        ParseResult parsed = parse(scanned.tokens());

        List<Diagnostic> errors = DiagnosticsEngine.inSourceOrder(scanned.errors(), parsed.errors());
        if (!errors.isEmpty()) {
            throw new CompilationException(errors);
        }
        return parsed.program();
    }
}
