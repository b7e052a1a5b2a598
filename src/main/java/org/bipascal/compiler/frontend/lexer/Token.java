package org.bipascal.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., Keyword, Identifier, Operator).
 * @param text The exact text of the token from the source code. Empty only for END_OF_FILE.
 * @param value The variant tag or processed value of the token: the {@link Keyword},
 *              {@link Operator}, {@link Delimiter} or {@link LexError} for the respective
 *              types, a {@link Long} or {@link Double} for numeric literals, the unquoted
 *              text for string and char literals, otherwise null.
 * @param position The position of the first character of the token.
 * @param fileName The logical file name of the source, for diagnostics.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        Position position,
        String fileName
) {

    public int line() {
        return position.line();
    }

    public int column() {
        return position.column();
    }

    public boolean is(Keyword keyword) {
        return type == TokenType.KEYWORD && value == keyword;
    }

    public boolean is(Operator operator) {
        return type == TokenType.OPERATOR && value == operator;
    }

    public boolean is(Delimiter delimiter) {
        return type == TokenType.DELIMITER && value == delimiter;
    }

    /**
     * @return The keyword of a KEYWORD token, otherwise null.
     */
    public Keyword keyword() {
        return type == TokenType.KEYWORD ? (Keyword) value : null;
    }

    /**
     * @return The operator of an OPERATOR token, otherwise null.
     */
    public Operator operator() {
        return type == TokenType.OPERATOR ? (Operator) value : null;
    }

    /**
     * @return The lexical error carried by an INVALID token, otherwise null.
     */
    public LexError error() {
        return type == TokenType.INVALID ? (LexError) value : null;
    }

    /**
     * Describes the token the way diagnostics quote it.
     * @return e.g. {@code 'begin'} or {@code end of file}.
     */
    public String describe() {
        return type == TokenType.END_OF_FILE ? "end of file" : "'" + text + "'";
    }
}
