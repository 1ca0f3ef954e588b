package org.loxfront.cli;

import org.loxfront.junit.extensions.logging.ExpectLog;
import org.loxfront.junit.extensions.logging.LogLevel;
import org.loxfront.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class CommandLineInterfaceTest {

    @Test
    void registersSubcommands() {
        CommandLine commandLine = CommandLineInterface.createCommandLine();

        assertThat(commandLine.getCommandName()).isEqualTo("loxfront");
        assertThat(commandLine.getSubcommands()).containsKeys("tokenize", "parse", "help");
    }

    @Test
    void printsUsageWithoutSubcommand() {
        CommandLine commandLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        commandLine.setOut(new PrintWriter(out, true));

        int exitCode = commandLine.execute();

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Usage: loxfront").contains("tokenize").contains("parse");
    }

    @Test
    void printsVersion() {
        CommandLine commandLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        commandLine.setOut(new PrintWriter(out, true));

        int exitCode = commandLine.execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("loxfront");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "(?s)Failed to load or parse configuration.*")
    void missingConfigFileExitsWithFailure(@TempDir Path tempDir) throws IOException {
        // Arrange
        CommandLine commandLine = CommandLineInterface.createCommandLine();
        StringWriter err = new StringWriter();
        commandLine.setErr(new PrintWriter(err, true));
        Path source = Files.writeString(tempDir.resolve("any.lox"), "1");

        // Act
        int exitCode = commandLine.execute("-c", tempDir.resolve("absent.conf").toString(), "tokenize", source.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_FAILURE);
        assertThat(err.toString()).startsWith("Error: ");
    }
}
