package org.bipascal.compiler.frontend.parser.ast;

/**
 * An expression.
 */
public interface ExpressionNode extends AstNode {
}
