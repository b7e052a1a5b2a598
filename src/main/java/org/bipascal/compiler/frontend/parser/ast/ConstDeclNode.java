package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;
import org.bipascal.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An AST node that represents a {@code name = constant} declaration.
 *
 * @param name The constant's identifier.
 * @param value The constant value: a literal, a signed numeric literal or another constant's name.
 */
public record ConstDeclNode(Token name, ExpressionNode value) implements DeclarationNode {

    @Override
    public Position position() {
        return name.position();
    }

    @Override
    public List<AstNode> getChildren() {
        return Nodes.children(value);
    }
}
