package org.bipascal.compiler.frontend.lexer;

/**
 * The reasons a run of characters can fail to form a token. Carried as the
 * value of {@link TokenType#INVALID} tokens.
 */
public enum LexError {
    /** A quoted literal reached a line break or the end of input before its closing quote. */
    UNTERMINATED_STRING("Unterminated string literal"),
    /** A comment reached the end of input before its closing marker. */
    UNTERMINATED_COMMENT("Unterminated comment"),
    /** The character cannot begin any token. */
    INVALID_CHARACTER("Invalid character");

    private final String reason;

    LexError(String reason) {
        this.reason = reason;
    }

    /**
     * @return A human-readable description of the error.
     */
    public String reason() {
        return reason;
    }
}
