package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;
import org.bipascal.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * One {@code a, b : type} group of a var section.
 *
 * @param names The declared identifiers.
 * @param type The declared type, or null if it could not be parsed.
 */
public record VarDeclNode(List<Token> names, TypeNode type) implements DeclarationNode {

    public VarDeclNode {
        names = List.copyOf(names);
    }

    @Override
    public Position position() {
        return names.get(0).position();
    }

    @Override
    public List<AstNode> getChildren() {
        return Nodes.children(type);
    }
}
