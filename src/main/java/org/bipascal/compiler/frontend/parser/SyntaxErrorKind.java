package org.bipascal.compiler.frontend.parser;

/**
 * The categories of syntax errors the parser records.
 */
public enum SyntaxErrorKind {
    /** A token that does not fit the grammar at its position. */
    UNEXPECTED_TOKEN,
    /** A {@code begin} block that is never closed by {@code end}. */
    UNCLOSED_BLOCK,
    /** A declaration (constant, type, variable, parameter or subprogram header) that cannot be read. */
    MALFORMED_DECLARATION,
    /** Neither a {@code program} header nor any {@code begin} block. Parsing stops at once. */
    MISSING_PROGRAM_STRUCTURE,
    /** The configured error limit was reached. Parsing stops at once. */
    TOO_MANY_ERRORS;

    /**
     * @return true if parsing cannot continue after an error of this kind.
     */
    public boolean isTerminal() {
        return this == MISSING_PROGRAM_STRUCTURE || this == TOO_MANY_ERRORS;
    }
}
