package org.bipascal.compiler.frontend.lexer;

import java.util.Objects;

/**
 * A cursor over the source text. Tracks line, column and offset and supports
 * peeking, advancing and resetting to a previously recorded {@link Position}.
 * The underlying text is never copied.
 */
public final class CharacterStream {

    /** Returned by {@link #peek()} once the end of the input has been reached. */
    public static final int END_OF_INPUT = -1;

    private final String source;
    private int offset = 0;
    private int line = 1;
    private int column = 1;

    /**
     * Creates a stream positioned at the start of the given text.
     * @param source The source text.
     */
    public CharacterStream(String source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * @return The character at the cursor, or {@link #END_OF_INPUT}.
     */
    public int peek() {
        return isAtEnd() ? END_OF_INPUT : source.charAt(offset);
    }

    /**
     * Consumes the character at the cursor.
     * @return The consumed character.
     * @throws IllegalStateException if the stream is already at the end.
     */
    public char advance() {
        if (isAtEnd()) {
            throw new IllegalStateException("Cannot advance past the end of the input");
        }
        char c = source.charAt(offset++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    public boolean isAtEnd() {
        return offset >= source.length();
    }

    /**
     * @return The current cursor position.
     */
    public Position position() {
        return new Position(line, column, offset);
    }

    /**
     * Moves the cursor back (or forward) to a position previously obtained from this stream.
     * @param position The position to restore.
     */
    public void reset(Position position) {
        if (position.offset() > source.length()) {
            throw new IllegalArgumentException("Position " + position + " lies outside the source");
        }
        this.offset = position.offset();
        this.line = position.line();
        this.column = position.column();
    }

    /**
     * Returns the text between two offsets without moving the cursor.
     * @param from The inclusive start offset.
     * @param to The exclusive end offset.
     * @return The slice of the source.
     */
    public String slice(int from, int to) {
        return source.substring(from, to);
    }

    public int length() {
        return source.length();
    }
}
