package org.bipascal.cli.commands;

import org.bipascal.cli.CommandLineInterface;
import org.bipascal.cli.config.LoggingConfigurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the {@code parse} subcommand end to end through picocli.
 */
@Tag("unit")
class ParseCommandTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine cmd;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        cmd = new CommandLine(new CommandLineInterface());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("input.pas");
        Files.writeString(file, content);
        return file;
    }

    @Test
    void validProgramReportsNoErrors() throws IOException {
        Path file = write("program ok; begin writeln('hi') end.");

        int exitCode = cmd.execute("parse", file.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).contains("0 errors").doesNotContain("[ERROR]");
    }

    @Test
    void treeOptionPrintsTheSyntaxTree() throws IOException {
        Path file = write("program ok; mulai writeln('hi') selesai.");

        int exitCode = cmd.execute("parse", "--tree", file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Program ok\n  Block\n    Call writeln\n      Literal 'hi'\n");
    }

    @Test
    void syntaxErrorsArePrintedWithPositions() throws IOException {
        Path file = write("program bad;\nbegin\n  x := ;\n  y := 1 +\nend.");

        int exitCode = cmd.execute("parse", file.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_SOURCE_ERRORS);
        assertThat(out.toString())
                .contains(":3:8: Expected an expression, found ';'")
                .contains(":5:1: Expected an expression, found 'end'")
                .contains("2 errors");
    }

    @Test
    void missingFileGivesExitCodeTwo() {
        int exitCode = cmd.execute("parse", tempDir.resolve("nope.pas").toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_IO_ERROR);
        assertThat(err.toString()).contains("Cannot read");
    }
}
