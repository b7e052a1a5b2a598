package org.bipascal.compiler.frontend.lexer;

import org.bipascal.compiler.diagnostics.DiagnosticsEngine;
import org.bipascal.compiler.frontend.CompilerPhase;
import org.bipascal.compiler.frontend.lexer.dfa.DfaEngine;
import org.bipascal.compiler.frontend.lexer.dfa.DfaMatch;
import org.bipascal.compiler.frontend.lexer.dfa.DfaState;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A lazy, single-pass sequence of tokens over one source text. Whitespace and
 * comments are consumed silently. The last token is always exactly one
 * {@link TokenType#END_OF_FILE}; after it the stream is exhausted.
 * A stream cannot be rewound; ask the {@link Lexer} for a new one instead.
 */
public final class TokenStream implements Iterator<Token> {

    private final CharacterStream input;
    private final DfaEngine engine;
    private final KeywordTable keywords;
    private final DiagnosticsEngine diagnostics;
    private final String fileName;
    private boolean exhausted = false;
    private int invalidCount = 0;

    TokenStream(CharacterStream input, DfaEngine engine, KeywordTable keywords,
                DiagnosticsEngine diagnostics, String fileName) {
        this.input = input;
        this.engine = engine;
        this.keywords = keywords;
        this.diagnostics = diagnostics;
        this.fileName = fileName;
    }

    @Override
    public boolean hasNext() {
        return !exhausted;
    }

    @Override
    public Token next() {
        if (exhausted) {
            throw new NoSuchElementException("Token stream is exhausted");
        }
        while (!input.isAtEnd()) {
            DfaMatch match = engine.run(input, engine.rules().startState());
            if (!match.isAccepted()) {
                return invalid(match);
            }
            if (!match.state().accepts().isTrivia()) {
                return token(match);
            }
        }
        exhausted = true;
        return new Token(TokenType.END_OF_FILE, "", null, input.position(), fileName);
    }

    /**
     * @return The number of INVALID tokens produced so far.
     */
    public int invalidCount() {
        return invalidCount;
    }

    private Token token(DfaMatch match) {
        DfaState state = match.state();
        String text = input.slice(match.start().offset(), match.end().offset());
        switch (state.accepts()) {
            case IDENTIFIER: {
                Keyword keyword = keywords.lookup(text);
                return keyword != null
                        ? new Token(TokenType.KEYWORD, text, keyword, match.start(), fileName)
                        : new Token(TokenType.IDENTIFIER, text, null, match.start(), fileName);
            }
            case INTEGER_LITERAL:
                return new Token(TokenType.INTEGER_LITERAL, text, integerValue(text, match), match.start(), fileName);
            case REAL_LITERAL:
                return new Token(TokenType.REAL_LITERAL, text, Double.parseDouble(text), match.start(), fileName);
            case STRING_LITERAL: {
                String content = text.substring(1, text.length() - 1).replace("''", "'");
                TokenType type = content.length() == 1 ? TokenType.CHAR_LITERAL : TokenType.STRING_LITERAL;
                return new Token(type, text, content, match.start(), fileName);
            }
            default:
                return new Token(state.accepts(), text, state.tag(), match.start(), fileName);
        }
    }

    private Long integerValue(String text, DfaMatch match) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            diagnostics.reportWarning(CompilerPhase.LEXING,
                    "Integer literal out of range: " + text, fileName, match.start());
            return null;
        }
    }

    private Token invalid(DfaMatch match) {
        LexError error = match.error();
        Position start = match.start();
        if (error == LexError.INVALID_CHARACTER || match.length() == 0) {
            // Skip exactly one character (one code point for surrogate pairs).
            input.reset(start);
            char c = input.advance();
            if (Character.isHighSurrogate(c) && !input.isAtEnd() && Character.isLowSurrogate((char) input.peek())) {
                input.advance();
            }
        }
        String text = input.slice(start.offset(), input.position().offset());
        invalidCount++;
        diagnostics.reportError(CompilerPhase.LEXING, error.reason() + ": " + abbreviate(text), fileName, start);
        return new Token(TokenType.INVALID, text, error, start, fileName);
    }

    private static String abbreviate(String text) {
        String firstLine = text.lines().findFirst().orElse("");
        return "'" + (firstLine.length() > 20 ? firstLine.substring(0, 20) + "..." : firstLine) + "'";
    }
}
