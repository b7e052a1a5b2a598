package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;
import org.bipascal.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code while condition do body}.
 */
public record WhileNode(Token whileToken, ExpressionNode condition, StatementNode body) implements StatementNode {

    @Override
    public Position position() {
        return whileToken.position();
    }

    @Override
    public List<AstNode> getChildren() {
        return Nodes.children(condition, body);
    }
}
