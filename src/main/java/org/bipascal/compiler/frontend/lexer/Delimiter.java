package org.bipascal.compiler.frontend.lexer;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Punctuation that separates or brackets constructs.
 */
public enum Delimiter {
    SEMICOLON(";"),
    COMMA(","),
    COLON(":"),
    LEFT_PAREN("("),
    RIGHT_PAREN(")"),
    LEFT_BRACKET("["),
    RIGHT_BRACKET("]"),
    DOT(".");

    private static final Map<String, Delimiter> BY_SYMBOL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Delimiter::symbol, Function.identity()));

    private final String symbol;

    Delimiter(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Looks up a delimiter by its source spelling.
     * @param symbol The symbol text.
     * @return The delimiter, or null if the text is not a delimiter.
     */
    public static Delimiter fromSymbol(String symbol) {
        return BY_SYMBOL.get(symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
