package org.bipascal.compiler.api;

/**
 * Which keyword spellings the lexer recognizes. A spelling that is not
 * recognized lexes as an ordinary identifier.
 */
public enum KeywordDialect {
    /** Both English and Indonesian spellings. */
    BILINGUAL,
    /** English spellings only. */
    ENGLISH,
    /** Indonesian spellings only. */
    INDONESIAN
}
