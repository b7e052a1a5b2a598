package org.bipascal.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** An identifier, such as a variable, type or procedure name. */
    IDENTIFIER,
    /** An unsigned integer literal, such as 42. */
    INTEGER_LITERAL,
    /** An unsigned real literal, such as 3.14 or 1e10. */
    REAL_LITERAL,
    /** A quoted literal with zero or more than one character. */
    STRING_LITERAL,
    /** A quoted literal with exactly one character, such as 'A'. */
    CHAR_LITERAL,

    // Keywords & symbols.
    /** A reserved word in either language; the value is the {@link Keyword}. */
    KEYWORD,
    /** An operator; the value is the {@link Operator}. */
    OPERATOR,
    /** A delimiter; the value is the {@link Delimiter}. */
    DELIMITER,

    // Trivia, accepted by the DFA but never emitted.
    /** A run of blanks, tabs and line breaks. */
    WHITESPACE(true),
    /** A { ... } or (* ... *) comment. */
    COMMENT(true),

    // Miscellaneous.
    /** Represents the end of the source file. */
    END_OF_FILE,
    /** Represents a lexical error; the value is the {@link LexError}. */
    INVALID;

    private final boolean trivia;

    TokenType() {
        this(false);
    }

    TokenType(boolean trivia) {
        this.trivia = trivia;
    }

    /**
     * @return true if tokens of this type are skipped by the lexer.
     */
    public boolean isTrivia() {
        return trivia;
    }
}
