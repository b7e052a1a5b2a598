package org.bipascal.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Helpers for assembling child lists of best-effort trees, where a child may be missing.
 * Null nodes are skipped.
 */
final class Nodes {

    private Nodes() {}

    static List<AstNode> children(AstNode... nodes) {
        return children(List.of(), nodes);
    }

    static List<AstNode> children(List<? extends AstNode> nodes) {
        return List.copyOf(nodes);
    }

    static List<AstNode> children(List<? extends AstNode> leading, AstNode... trailing) {
        return children(leading, List.of(), trailing);
    }

    static List<AstNode> children(List<? extends AstNode> first, List<? extends AstNode> second, AstNode... trailing) {
        List<AstNode> children = new ArrayList<>(first);
        children.addAll(second);
        for (AstNode node : trailing) {
            if (node != null) {
                children.add(node);
            }
        }
        return Collections.unmodifiableList(children);
    }
}
