package org.bipascal.compiler.frontend.parser.ast;

import org.bipascal.compiler.frontend.lexer.Position;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the syntax tree.
 * Every node owns its children outright; the tree has no shared nodes and no cycles.
 */
public interface AstNode {

    /**
     * @return The position of the node's leading token, for error reporting.
     */
    Position position();

    /**
     * Returns a list of the direct child nodes, in source order.
     * This allows generic code to traverse the tree
     * without knowing the specific structure of each node.
     * Children that could not be parsed are omitted.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
