package org.bipascal.compiler.frontend.lexer;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Operator symbols.
 */
public enum Operator {
    ASSIGN(":="),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),
    NOT_EQUAL("<>"),
    RANGE(".."),
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    LESS("<"),
    GREATER(">"),
    EQUAL("=");

    private static final Map<String, Operator> BY_SYMBOL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Operator::symbol, Function.identity()));

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Looks up an operator by its source spelling.
     * @param symbol The symbol text.
     * @return The operator, or null if the text is not an operator.
     */
    public static Operator fromSymbol(String symbol) {
        return BY_SYMBOL.get(symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
