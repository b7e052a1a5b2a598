package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;
import org.bipascal.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An AST node that represents a {@code name = type} declaration.
 *
 * @param name The declared type name.
 * @param type The type denoter.
 */
public record TypeDeclNode(Token name, TypeNode type) implements DeclarationNode {

    @Override
    public Position position() {
        return name.position();
    }

    @Override
    public List<AstNode> getChildren() {
        return Nodes.children(type);
    }
}
