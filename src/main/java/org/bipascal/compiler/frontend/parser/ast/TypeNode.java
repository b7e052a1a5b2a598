package org.bipascal.compiler.frontend.parser.ast;

/**
 * A type denoter: a type name, a subrange or an array type.
 */
public interface TypeNode extends AstNode {
}
