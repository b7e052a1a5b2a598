package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;
import org.bipascal.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A procedure call statement such as {@code writeln('hi')} or {@code reset}.
 *
 * @param name The procedure name.
 * @param arguments The arguments; empty when called without parentheses.
 */
public record ProcedureCallNode(Token name, List<ExpressionNode> arguments) implements StatementNode {

    public ProcedureCallNode {
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
