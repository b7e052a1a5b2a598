package org.bipascal.compiler;

import org.bipascal.compiler.api.FrontendOptions;
import org.bipascal.compiler.api.FrontendResult;
import org.bipascal.compiler.api.IFrontend;
import org.bipascal.compiler.diagnostics.DiagnosticsEngine;
import org.bipascal.compiler.frontend.lexer.Lexer;
import org.bipascal.compiler.frontend.lexer.Token;
import org.bipascal.compiler.frontend.parser.ParseResult;
import org.bipascal.compiler.frontend.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * The frontend implementation. It runs the lexer and the parser over one source
 * text with a fresh {@link DiagnosticsEngine}, so instances may be shared.
 */
public class Frontend implements IFrontend {

    private static final Logger LOG = LoggerFactory.getLogger(Frontend.class);

    private final FrontendOptions options;

    public Frontend() {
        this(FrontendOptions.defaults());
    }

    public Frontend(FrontendOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    @Override
    public FrontendResult analyze(String source, String fileName) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexing
        List<Token> tokens = new Lexer(source, diagnostics, fileName, options).scanTokens();

        // Phase 2: Parsing
        ParseResult parse = new Parser(tokens, diagnostics, options).parse();

        if (diagnostics.hasErrors()) {
            LOG.debug("Analysis of {} finished with {} errors", fileName, diagnostics.errorCount());
        } else {
            LOG.debug("Analysis of {} finished without errors", fileName);
        }
        return new FrontendResult(tokens, parse, diagnostics.getDiagnostics());
    }
}
