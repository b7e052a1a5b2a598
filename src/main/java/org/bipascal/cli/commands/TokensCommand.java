package org.bipascal.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.bipascal.cli.CommandLineInterface;
import org.bipascal.compiler.api.FrontendOptions;
import org.bipascal.compiler.diagnostics.Diagnostic;
import org.bipascal.compiler.diagnostics.DiagnosticsEngine;
import org.bipascal.compiler.frontend.lexer.Lexer;
import org.bipascal.compiler.frontend.lexer.Token;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "tokens", description = "Prints the token stream of a Pascal-S source file.")
public class TokensCommand implements Callable<Integer> {

    /** The output formats of the token listing. */
    public enum Format { TEXT, JSON }

    @Parameters(index = "0", description = "The Pascal-S source file.")
    private File file;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "TEXT"
    )
    private Format format;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String source;
        try {
            source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Cannot read " + file + ": " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }

        FrontendOptions options = parent.getFrontendOptions();
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(source, diagnostics, file.getPath(), options).scanTokens();

        if (format == Format.JSON) {
            List<TokenEntry> entries = new ArrayList<>();
            for (int i = 0; i < tokens.size(); i++) {
                Token token = tokens.get(i);
                entries.add(new TokenEntry(i, token.type().name(), token.text(), token.line(), token.column()));
            }
            Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
            out.println(gson.toJson(entries));
        } else {
            for (int i = 0; i < tokens.size(); i++) {
                Token token = tokens.get(i);
                out.println(i + "\t" + token.type() + "\t" + token.text() + "\t" + token.line() + "\t" + token.column());
            }
        }
        out.flush();

        for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            err.println(diagnostic);
        }
        err.flush();
        return diagnostics.hasErrors() ? CommandLineInterface.EXIT_SOURCE_ERRORS : CommandLineInterface.EXIT_OK;
    }

    private record TokenEntry(int index, String kind, String lexeme, int line, int column) {}
}
