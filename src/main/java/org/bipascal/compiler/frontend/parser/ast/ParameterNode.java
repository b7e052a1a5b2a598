package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;
import org.bipascal.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * One parameter group of a subprogram header, e.g. {@code var a, b : integer}.
 *
 * @param names The parameter names.
 * @param type The parameter type.
 * @param byReference Whether the group was declared with {@code var}.
 */
public record ParameterNode(List<Token> names, TypeNode type, boolean byReference) implements AstNode {

    public ParameterNode {
        names = List.copyOf(names);
    }

    @Override
    public Position position() {
        return names.get(0).position();
    }

    @Override
    public List<AstNode> getChildren() {
        return Nodes.children(type);
    }
}
