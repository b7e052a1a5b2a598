package org.bipascal.compiler.frontend.lexer;

import org.bipascal.compiler.api.FrontendOptions;
import org.bipascal.compiler.diagnostics.DiagnosticsEngine;
import org.bipascal.compiler.frontend.lexer.dfa.DfaEngine;
import org.bipascal.compiler.frontend.lexer.dfa.DfaRuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Recognition is driven by the shared {@link DfaRuleSet}; words are then
 * reclassified as keywords through the {@link KeywordTable} of the configured
 * dialect. Lexical errors become {@link TokenType#INVALID} tokens plus an error
 * diagnostic, and scanning continues.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private static final DfaEngine ENGINE = new DfaEngine(DfaRuleSet.standard());

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;
    private final KeywordTable keywords;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being lexed, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this(source, diagnostics, logicalFileName, FrontendOptions.defaults());
    }

    /**
     * Creates a new Lexer with explicit options.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being lexed, for error reporting.
     * @param options The keyword dialect and casing policy.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName, FrontendOptions options) {
        this.source = Objects.requireNonNull(source, "source");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.logicalFileName = logicalFileName;
        this.keywords = KeywordTable.forDialect(options.dialect(), options.caseSensitiveKeywords());
    }

    /**
     * Starts a fresh pass over the source. Each call scans from the beginning
     * and reports its own lexical errors.
     * @return A lazy token stream.
     */
    public TokenStream tokens() {
        return new TokenStream(new CharacterStream(source), ENGINE, keywords, diagnostics, logicalFileName);
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, ending with END_OF_FILE.
     */
    public List<Token> scanTokens() {
        TokenStream stream = tokens();
        List<Token> tokens = new ArrayList<>();
        while (stream.hasNext()) {
            tokens.add(stream.next());
        }
        LOG.debug("Tokenized {}: {} tokens, {} lexical errors", logicalFileName, tokens.size(), stream.invalidCount());
        return tokens;
    }
}
