package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;
import org.bipascal.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A {@code begin ... end} compound statement.
 *
 * @param begin The opening {@code begin}/{@code mulai} token.
 * @param statements The statements in source order, including empty ones.
 */
public record BlockNode(Token begin, List<StatementNode> statements) implements StatementNode {

    public BlockNode {
        statements = List.copyOf(statements);
    }

    @Override
    public Position position() {
        return begin.position();
    }

    @Override
    public List<AstNode> getChildren() {
        return Nodes.children(statements);
    }
}
