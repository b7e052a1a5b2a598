package org.bipascal.compiler.frontend.parser;

import org.bipascal.compiler.frontend.lexer.Token;
import org.bipascal.compiler.frontend.parser.ast.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a syntax tree as indented text, one node per line, children indented
 * by two spaces. Operators are printed by their canonical name, so equivalent
 * English and Indonesian programs print identically.
 */
public final class SyntaxTreePrinter {

    private static final String INDENT = "  ";

    public String print(AstNode node) {
        StringBuilder builder = new StringBuilder();
        print(node, 0, builder);
        return builder.toString();
    }

    private void print(AstNode node, int depth, StringBuilder builder) {
        builder.append(INDENT.repeat(depth)).append(label(node)).append('\n');
        for (AstNode child : node.getChildren()) {
            print(child, depth + 1, builder);
        }
    }

    private static String label(AstNode node) {
        if (node instanceof ProgramNode n) return "Program " + text(n.name());
        if (node instanceof VarDeclNode n) return "Var " + names(n.names());
        if (node instanceof ConstDeclNode n) return "Const " + text(n.name());
        if (node instanceof TypeDeclNode n) return "Type " + text(n.name());
        if (node instanceof ParameterNode n) return "Parameter " + names(n.names()) + (n.byReference() ? " (var)" : "");
        if (node instanceof ProcedureDeclNode n) return "Procedure " + text(n.name());
        if (node instanceof FunctionDeclNode n) return "Function " + text(n.name());
        if (node instanceof NamedTypeNode n) return "NamedType " + text(n.name());
        if (node instanceof SubrangeTypeNode) return "Subrange";
        if (node instanceof ArrayTypeNode) return "Array";
        if (node instanceof BlockNode) return "Block";
        if (node instanceof AssignmentNode) return "Assign";
        if (node instanceof IfNode n) return n.hasElse() ? "If (else)" : "If";
        if (node instanceof WhileNode) return "While";
        if (node instanceof ForNode n) return "For " + text(n.variable()) + (n.downTo() ? " downto" : " to");
        if (node instanceof ProcedureCallNode n) return "Call " + text(n.name());
        if (node instanceof EmptyStatementNode) return "Empty";
        if (node instanceof BinaryNode n) return "Binary " + n.operator();
        if (node instanceof UnaryNode n) return "Unary " + n.operator();
        if (node instanceof LiteralNode n) return "Literal " + n.literalToken().text();
        if (node instanceof VariableNode n) return "Variable " + text(n.name()) + (n.isIndexed() ? "[]" : "");
        if (node instanceof FunctionCallNode n) return "FunctionCall " + text(n.name());
        return node.getClass().getSimpleName();
    }

    private static String text(Token token) {
        return token != null ? token.text() : "<missing>";
    }

    private static String names(List<Token> tokens) {
        return tokens.stream().map(Token::text).collect(Collectors.joining(", "));
    }
}
