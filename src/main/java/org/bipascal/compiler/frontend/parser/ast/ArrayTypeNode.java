package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;
import org.bipascal.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code array[low..high] of elementType}.
 *
 * @param arrayToken The {@code array}/{@code larik} token.
 * @param range The index range, or null if it could not be parsed.
 * @param elementType The element type, or null if it could not be parsed.
 */
public record ArrayTypeNode(Token arrayToken, SubrangeTypeNode range, TypeNode elementType) implements TypeNode {

    @Override
    public Position position() {
        return arrayToken.position();
    }

    @Override
    public List<AstNode> getChildren() {
        return Nodes.children(range, elementType);
    }
}
