package org.loxfront.cli.commands;

import org.loxfront.cli.CommandLineInterface;
import org.loxfront.compiler.FrontEnd;
import org.loxfront.compiler.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Shared plumbing of the commands that process one source file: reading the file,
 * building the front end from configuration and reporting diagnostics.
 */
abstract class SourceFileCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(SourceFileCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", paramLabel = "<path>", description = "The source file to process.")
    private Path file;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.debug("Could not read {}", file, e);
            err().println("Failed to read file " + file);
            return CommandLineInterface.EXIT_NO_INPUT;
        }
        return run(new FrontEnd(parent.getFrontEndOptions()), source);
    }

    /**
     * Processes the source text.
     * @param frontEnd The configured front end.
     * @param source The content of the source file.
     * @return The exit code.
     */
    protected abstract int run(FrontEnd frontEnd, String source);

    /**
     * Prints diagnostics to standard error, one per line.
     * @param diagnostics The diagnostics in source order.
     */
    protected void report(List<Diagnostic> diagnostics) {
        for (Diagnostic diagnostic : diagnostics) {
            err().println(diagnostic);
        }
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }
}
