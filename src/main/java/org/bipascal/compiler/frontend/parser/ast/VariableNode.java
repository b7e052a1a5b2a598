package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;
import org.bipascal.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A variable reference, optionally indexed: {@code x} or {@code a[i + 1]}.
 *
 * @param name The identifier token.
 * @param index The index expression, or null for a plain reference.
 */
public record VariableNode(Token name, ExpressionNode index) implements ExpressionNode {

    @Override
    public Position position() {
        return name.position();
    }

    public boolean isIndexed() {
        return index != null;
    }

    @Override
    public List<AstNode> getChildren() {
        return Nodes.children(index);
    }
}
