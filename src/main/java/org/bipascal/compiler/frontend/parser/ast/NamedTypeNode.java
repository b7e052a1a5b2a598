package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;
import org.bipascal.compiler.frontend.lexer.Token;

/**
 * A reference to a type by name, e.g. {@code integer} or a declared type.
 *
 * @param name The type name token.
 */
public record NamedTypeNode(Token name) implements TypeNode {

    @Override
    public Position position() {
        return name.position();
    }
    // This node has no children and inherits the empty list from getChildren().
}
