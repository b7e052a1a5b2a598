package org.bipascal.compiler.frontend.parser.ast;

/**
 * A declaration in a program or subprogram header part.
 */
public interface DeclarationNode extends AstNode {
}
