package org.bipascal.compiler.frontend.lexer.dfa;

import org.bipascal.compiler.frontend.lexer.CharacterStream;

/**
 * The input alphabet of the lexical DFA. Every source character falls into exactly one class.
 */
public enum CharClass {
    /** An ASCII letter other than e/E. */
    LETTER,
    /** The letters e and E, which also mark the exponent of a real literal. */
    LETTER_E,
    DIGIT,
    UNDERSCORE,
    /** Blank, tab or form feed. */
    WHITESPACE,
    /** Line feed or carriage return. */
    NEWLINE,
    QUOTE,
    LEFT_BRACE,
    RIGHT_BRACE,
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    STAR,
    COLON,
    SEMICOLON,
    COMMA,
    EQUAL,
    LESS,
    GREATER,
    DOT,
    PLUS,
    MINUS,
    SLASH,
    /** Any character the language does not use. */
    OTHER,
    /** Pseudo-class for the position after the last character. No state has an edge on it. */
    END_OF_INPUT;

    /**
     * Classifies a character as returned by {@link CharacterStream#peek()}.
     * @param c The character, or {@link CharacterStream#END_OF_INPUT}.
     * @return Its class.
     */
    public static CharClass classify(int c) {
        if (c == CharacterStream.END_OF_INPUT) return END_OF_INPUT;
        if (c == 'e' || c == 'E') return LETTER_E;
        if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')) return LETTER;
        if (c >= '0' && c <= '9') return DIGIT;
        switch (c) {
            case '_': return UNDERSCORE;
            case ' ', '\t', '\f': return WHITESPACE;
            case '\n', '\r': return NEWLINE;
            case '\'': return QUOTE;
            case '{': return LEFT_BRACE;
            case '}': return RIGHT_BRACE;
            case '(': return LEFT_PAREN;
            case ')': return RIGHT_PAREN;
            case '[': return LEFT_BRACKET;
            case ']': return RIGHT_BRACKET;
            case '*': return STAR;
            case ':': return COLON;
            case ';': return SEMICOLON;
            case ',': return COMMA;
            case '=': return EQUAL;
            case '<': return LESS;
            case '>': return GREATER;
            case '.': return DOT;
            case '+': return PLUS;
            case '-': return MINUS;
            case '/': return SLASH;
            default: return OTHER;
        }
    }
}
