package com.ciro.jrxpass.ir;

/**
 * Corrida de HTML opaco. Sus hijos son {@link IrToken} cuyo contenido concatenado
 * forma el buffer que se tokeniza. Desaparece del árbol tras la reescritura.
 */
public class HtmlContentNode extends IrNode {

    public HtmlContentNode() {
    }

    public HtmlContentNode(String html) {
        addChild(new IrToken(IrToken.Kind.HTML, html));
    }

    public String content() {
        StringBuilder sb = new StringBuilder();
        for (IrNode child : children) {
            if (child instanceof IrToken token) {
                sb.append(token.content);
            }
        }
        return sb.toString();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.HTML_CONTENT;
    }
}
