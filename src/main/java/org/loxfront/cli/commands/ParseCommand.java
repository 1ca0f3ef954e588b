package org.loxfront.cli.commands;

import org.loxfront.cli.CommandLineInterface;
import org.loxfront.compiler.FrontEnd;
import org.loxfront.compiler.api.ExpressionResult;
import org.loxfront.compiler.api.ParseResult;
import org.loxfront.compiler.api.ScanResult;
import org.loxfront.compiler.diagnostics.Diagnostic;
import org.loxfront.compiler.diagnostics.DiagnosticsEngine;
import org.loxfront.compiler.frontend.printer.AstPrinter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

@Command(name = "parse", description = "Parses a source file and prints its syntax tree in prefix form.")
public class ParseCommand extends SourceFileCommand {

    @Option(names = {"-p", "--program"}, description = "Parse a whole program instead of a single expression.")
    private boolean program;

    @Override
    protected int run(FrontEnd frontEnd, String source) {
        ScanResult scanned = frontEnd.scan(source);
        AstPrinter printer = new AstPrinter();

        List<Diagnostic> errors;
        String rendering;
        if (program) {
            ParseResult parsed = frontEnd.parse(scanned.tokens());
            errors = DiagnosticsEngine.inSourceOrder(scanned.errors(), parsed.errors());
            rendering = printer.print(parsed.program());
        } else {
            ExpressionResult parsed = frontEnd.parseExpression(scanned.tokens());
            errors = DiagnosticsEngine.inSourceOrder(scanned.errors(), parsed.errors());
            rendering = parsed.asOptional().map(printer::print).orElse("");
        }

        if (!errors.isEmpty()) {
            report(errors);
            return CommandLineInterface.EXIT_DATA_ERROR;
        }
        if (!rendering.isEmpty()) {
            out().println(rendering);
        }
        out().flush();
        return CommandLineInterface.EXIT_OK;
    }
}
