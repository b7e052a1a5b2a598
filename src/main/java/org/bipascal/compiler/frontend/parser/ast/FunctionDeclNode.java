package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;
import org.bipascal.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function declaration.
 *
 * @param keyword The {@code function}/{@code fungsi} token.
 * @param name The function name, or null if missing.
 * @param parameters The parameter groups.
 * @param returnType The result type, or null if it could not be parsed.
 * @param declarations The local declarations.
 * @param body The function body, or null if it could not be parsed.
 */
public record FunctionDeclNode(
        Token keyword,
        Token name,
        List<ParameterNode> parameters,
        TypeNode returnType,
        List<DeclarationNode> declarations,
        BlockNode body
) implements DeclarationNode {

    public FunctionDeclNode {
        parameters = List.copyOf(parameters);
        declarations = List.copyOf(declarations);
    }

    @Override
    public Position position() {
        return keyword.position();
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(parameters);
        if (returnType != null) {
            children.add(returnType);
        }
        children.addAll(Nodes.children(declarations, body));
        return Collections.unmodifiableList(children);
    }
}
