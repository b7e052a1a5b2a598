package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;

import java.util.List;

/**
 * {@code target := value}.
 *
 * @param target The assigned variable.
 * @param value The assigned expression, or null if it could not be parsed.
 */
public record AssignmentNode(VariableNode target, ExpressionNode value) implements StatementNode {

    @Override
    public Position position() {
        return target.position();
    }

    @Override
    public List<AstNode> getChildren() {
        return Nodes.children(target, value);
    }
}
