package com.ciro.jrxpass.ir;

import java.util.List;

/**
 * Volcado legible del árbol, una línea por nodo e indentado por profundidad.
 * Se usa en los logs de traza y en los tests para comparar estructuras.
 */
public final class IrPrinter {

    private IrPrinter() {}

    public static String print(IrNode root) {
        StringBuilder sb = new StringBuilder();
        printNode(root, 0, sb);
        return sb.toString();
    }

    public static String printChildren(List<IrNode> nodes) {
        StringBuilder sb = new StringBuilder();
        for (IrNode n : nodes) printNode(n, 0, sb);
        return sb.toString();
    }

    private static void printNode(IrNode node, int depth, StringBuilder sb) {
        sb.append("  ".repeat(depth));
        switch (node.kind()) {
            case DOCUMENT -> sb.append("Document");
            case METHOD -> sb.append("Method ").append(((MethodNode) node).methodName);
            case HTML_CONTENT -> sb.append("HtmlContent ").append(quote(((HtmlContentNode) node).content()));
            case HTML_ELEMENT -> sb.append("Element ").append(((HtmlElementNode) node).tagName);
            case HTML_ATTRIBUTE -> sb.append("Attribute ").append(((HtmlAttributeNode) node).attributeName);
            case HTML_ATTRIBUTE_VALUE -> sb.append("AttributeValue");
            case EXPRESSION_ATTRIBUTE_VALUE -> sb.append("ExpressionAttributeValue");
            case HTML_TEXT -> sb.append("Text ").append(quote(((HtmlTextNode) node).content));
            case EXPRESSION -> sb.append("Expression");
            case STATEMENT -> sb.append("Statement ").append(((StatementNode) node).code);
            case TOKEN -> {
                IrToken token = (IrToken) node;
                sb.append("Token ").append(token.tokenKind).append(' ').append(quote(token.content));
            }
        }
        sb.append('\n');

        for (IrNode child : node.getChildren()) {
            printNode(child, depth + 1, sb);
        }
    }

    private static String quote(String s) {
        if (s == null) return "null";
        return "\"" + s.replace("\\", "\\\\").replace("\n", "\\n").replace("\r", "\\r").replace("\t", "\\t") + "\"";
    }
}
