package org.bipascal.compiler.frontend.parser.ast;

/**
 * Binary operators with their binding strength. Higher binds tighter.
 */
public enum BinaryOperator {
    OR(1),
    AND(2),
    EQUAL(3),
    NOT_EQUAL(3),
    LESS(3),
    LESS_EQUAL(3),
    GREATER(3),
    GREATER_EQUAL(3),
    ADD(4),
    SUBTRACT(4),
    MULTIPLY(5),
    DIVIDE(5),
    INT_DIVIDE(5),
    MODULO(5);

    /** The precedence of the non-associative comparison level. */
    public static final int RELATIONAL = 3;

    private final int precedence;

    BinaryOperator(int precedence) {
        this.precedence = precedence;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isRelational() {
        return precedence == RELATIONAL;
    }
}
