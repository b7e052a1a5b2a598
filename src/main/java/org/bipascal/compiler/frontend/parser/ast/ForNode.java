package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;
import org.bipascal.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code for variable := start to|downto end do body}.
 *
 * @param forToken The {@code for}/{@code untuk} token.
 * @param variable The control variable, or null if missing.
 * @param start The initial value.
 * @param end The final value.
 * @param downTo Whether the loop counts down.
 * @param body The loop body.
 */
public record ForNode(
        Token forToken,
        Token variable,
        ExpressionNode start,
        ExpressionNode end,
        boolean downTo,
        StatementNode body
) implements StatementNode {

    @Override
    public Position position() {
        return forToken.position();
    }

    @Override
    public List<AstNode> getChildren() {
        return Nodes.children(start, end, body);
    }
}
