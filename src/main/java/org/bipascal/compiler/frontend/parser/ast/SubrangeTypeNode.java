package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;

import java.util.List;

/**
 * A subrange {@code low..high}. The bounds are only checked for shape; whether
 * {@code low <= high} holds is left to a later phase.
 *
 * @param low The lower bound: an integer or char literal, a negated integer literal or a constant name.
 * @param high The upper bound, or null if it could not be parsed.
 */
public record SubrangeTypeNode(ExpressionNode low, ExpressionNode high) implements TypeNode {

    @Override
    public Position position() {
        return low.position();
    }

    @Override
    public List<AstNode> getChildren() {
        return Nodes.children(low, high);
    }
}
