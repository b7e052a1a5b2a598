package org.bipascal.compiler.frontend.parser.ast;

/**
 * A statement inside a block.
 */
public interface StatementNode extends AstNode {
}
