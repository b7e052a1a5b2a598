package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;
import org.bipascal.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A binary operation.
 *
 * @param operator The operator.
 * @param operatorToken The operator's token, in whichever spelling the source used.
 * @param left The left operand.
 * @param right The right operand.
 */
public record BinaryNode(
        BinaryOperator operator,
        Token operatorToken,
        ExpressionNode left,
        ExpressionNode right
) implements ExpressionNode {

    @Override
    public Position position() {
        return left.position();
    }

    @Override
    public List<AstNode> getChildren() {
        return Nodes.children(left, right);
    }
}
