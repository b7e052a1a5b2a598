package org.bipascal.compiler.frontend.parser;

import org.bipascal.compiler.frontend.lexer.Position;
import org.bipascal.compiler.frontend.lexer.Token;

/**
 * A syntax error found by the {@link Parser}.
 *
 * @param kind The category of the error.
 * @param position Where the error was detected.
 * @param expected What the parser expected at that position, in words.
 * @param found The token the parser found instead.
 */
public record SyntaxError(
        SyntaxErrorKind kind,
        Position position,
        String expected,
        Token found
) {

    public String message() {
        if (kind == SyntaxErrorKind.TOO_MANY_ERRORS) {
            return "Too many syntax errors, parsing stopped at " + found.describe() + " (limit: " + expected + ")";
        }
        return "Expected " + expected + ", found " + found.describe();
    }

    @Override
    public String toString() {
        return kind + " at " + position + ": " + message();
    }
}
