package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;
import org.bipascal.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * The root of the syntax tree.
 *
 * @param position The position of the program header, or of the first token if the header is missing.
 * @param name The program name, or null if the header could not be parsed.
 * @param declarations The declarations in source order.
 * @param block The main block, or null if none could be parsed.
 */
public record ProgramNode(
        Position position,
        Token name,
        List<DeclarationNode> declarations,
        BlockNode block
) implements AstNode {

    public ProgramNode {
        declarations = List.copyOf(declarations);
    }

    @Override
    public List<AstNode> getChildren() {
        return Nodes.children(declarations, block);
    }
}
