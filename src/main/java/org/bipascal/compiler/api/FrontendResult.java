package org.bipascal.compiler.api;

import org.bipascal.compiler.diagnostics.Diagnostic;
import org.bipascal.compiler.frontend.lexer.Token;
import org.bipascal.compiler.frontend.parser.ParseResult;

import java.util.List;

/**
 * Everything the frontend learned about one source text.
 *
 * @param tokens The significant tokens, including INVALID ones, ending with END_OF_FILE.
 * @param parse The syntax tree and syntax errors.
 * @param diagnostics The lexical and syntax diagnostics in the order they were reported.
 */
public record FrontendResult(List<Token> tokens, ParseResult parse, List<Diagnostic> diagnostics) {

    public FrontendResult {
        tokens = List.copyOf(tokens);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return errorCount() > 0;
    }

    public long errorCount() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).count();
    }
}
