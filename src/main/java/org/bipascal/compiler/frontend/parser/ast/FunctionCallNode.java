package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;
import org.bipascal.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A function call inside an expression, e.g. {@code sqr(x)}.
 */
public record FunctionCallNode(Token name, List<ExpressionNode> arguments) implements ExpressionNode {

    public FunctionCallNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public Position position() {
        return name.position();
    }

    @Override
    public List<AstNode> getChildren() {
        return Nodes.children(arguments);
    }
}
