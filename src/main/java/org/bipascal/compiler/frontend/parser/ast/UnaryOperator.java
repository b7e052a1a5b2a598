package org.bipascal.compiler.frontend.parser.ast;

/**
 * Prefix operators.
 */
public enum UnaryOperator {
    NEGATE,
    PLUS,
    NOT
}
