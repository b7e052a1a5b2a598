package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;
import org.bipascal.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A prefix operation such as {@code -x} or {@code not done}.
 *
 * @param operator The operator.
 * @param operatorToken The operator's token.
 * @param operand The operand, or null if it could not be parsed.
 */
public record UnaryNode(UnaryOperator operator, Token operatorToken, ExpressionNode operand) implements ExpressionNode {

    @Override
    public Position position() {
        return operatorToken.position();
    }

    @Override
    public List<AstNode> getChildren() {
        return Nodes.children(operand);
    }
}
