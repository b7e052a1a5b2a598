package org.bipascal.cli.commands;

import org.bipascal.cli.CommandLineInterface;
import org.bipascal.compiler.Frontend;
import org.bipascal.compiler.api.FrontendResult;
import org.bipascal.compiler.diagnostics.Diagnostic;
import org.bipascal.compiler.frontend.parser.SyntaxTreePrinter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "parse", description = "Parses a Pascal-S source file and reports its diagnostics.")
public class ParseCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "The Pascal-S source file.")
    private File file;

    @Option(names = {"-t", "--tree"}, description = "Also print the syntax tree.")
    private boolean printTree;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        FrontendResult result;
        try {
            result = new Frontend(parent.getFrontendOptions()).analyze(file.toPath());
        } catch (IOException e) {
            err.println("Cannot read " + file + ": " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }

        for (Diagnostic diagnostic : result.diagnostics()) {
            out.println(diagnostic);
        }
        if (printTree && result.parse().program() != null) {
            out.print(new SyntaxTreePrinter().print(result.parse().program()));
        }
        long errors = result.errorCount();
        out.println(file.getPath() + ": " + errors + (errors == 1 ? " error" : " errors"));
        out.flush();
        return result.hasErrors() ? CommandLineInterface.EXIT_SOURCE_ERRORS : CommandLineInterface.EXIT_OK;
    }
}
