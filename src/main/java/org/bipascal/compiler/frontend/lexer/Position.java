package org.bipascal.compiler.frontend.lexer;

/**
 * A location in the source text.
 *
 * @param line The 1-based line number.
 * @param column The 1-based column number.
 * @param offset The 0-based character offset from the start of the source.
 */
public record Position(int line, int column, int offset) {

    /** The position of the first character of any source. */
    public static final Position START = new Position(1, 1, 0);

    public Position {
        if (line < 1 || column < 1 || offset < 0) {
            throw new IllegalArgumentException("Invalid position " + line + ":" + column + "@" + offset);
        }
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
