package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;
import org.bipascal.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code if condition then thenBranch [else elseBranch]}.
 *
 * @param ifToken The {@code if}/{@code jika} token.
 * @param condition The condition, or null if it could not be parsed.
 * @param thenBranch The statement executed when the condition holds.
 * @param elseBranch The alternative, or null when there is no else part.
 */
public record IfNode(
        Token ifToken,
        ExpressionNode condition,
        StatementNode thenBranch,
        StatementNode elseBranch
) implements StatementNode {

    @Override
    public Position position() {
        return ifToken.position();
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public List<AstNode> getChildren() {
        return Nodes.children(condition, thenBranch, elseBranch);
    }
}
