package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;
import org.bipascal.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A procedure declaration with its own declarations and body.
 *
 * @param keyword The {@code procedure}/{@code prosedur} token.
 * @param name The procedure name, or null if missing.
 * @param parameters The parameter groups.
 * @param declarations The local declarations.
 * @param body The procedure body, or null if it could not be parsed.
 */
public record ProcedureDeclNode(
        Token keyword,
        Token name,
        List<ParameterNode> parameters,
        List<DeclarationNode> declarations,
        BlockNode body
) implements DeclarationNode {

    public ProcedureDeclNode {
        parameters = List.copyOf(parameters);
        declarations = List.copyOf(declarations);
    }

    @Override
    public Position position() {
        return keyword.position();
    }

    @Override
    public List<AstNode> getChildren() {
        return Nodes.children(parameters, declarations, body);
    }
}
