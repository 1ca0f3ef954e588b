package org.loxfront.cli.commands;

import org.loxfront.cli.CommandLineInterface;
import org.loxfront.compiler.FrontEnd;
import org.loxfront.compiler.api.ScanResult;
import org.loxfront.compiler.frontend.lexer.Token;
import picocli.CommandLine.Command;

import java.io.PrintWriter;

@Command(name = "tokenize", description = "Scans a source file and prints one token per line.")
public class TokenizeCommand extends SourceFileCommand {

    @Override
    protected int run(FrontEnd frontEnd, String source) {
        ScanResult result = frontEnd.scan(source);
        report(result.errors());

        PrintWriter out = out();
        for (Token token : result.tokens()) {
            out.println(token.format());
        }
        out.flush();

        return result.hasErrors() ? CommandLineInterface.EXIT_DATA_ERROR : CommandLineInterface.EXIT_OK;
    }
}
