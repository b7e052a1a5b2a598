package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;
import org.bipascal.compiler.frontend.lexer.Token;
import org.bipascal.compiler.frontend.lexer.TokenType;

/**
 * An AST node that represents an integer, real, string or char literal.
 *
 * @param literalToken The token containing the literal.
 */
public record LiteralNode(Token literalToken) implements ExpressionNode {

    @Override
    public Position position() {
        return literalToken.position();
    }

    public TokenType kind() {
        return literalToken.type();
    }

    /**
     * Gets the processed value of the literal.
     * @return A {@link Long}, {@link Double} or {@link String}; null for an out-of-range integer.
     */
    public Object value() {
        return literalToken.value();
    }

    // This node has no children and inherits the empty list from getChildren().
}
