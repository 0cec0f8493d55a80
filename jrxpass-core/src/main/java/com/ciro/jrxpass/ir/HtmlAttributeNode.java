package com.ciro.jrxpass.ir;

/**
 * Atributo de un elemento. Tiene un único hijo: el valor, ya sea literal
 * ({@link HtmlAttributeValueNode}) o una expresión ({@link ExpressionAttributeValueNode}).
 */
public class HtmlAttributeNode extends IrNode {
    public final String attributeName;

    public HtmlAttributeNode(String attributeName) {
        this.attributeName = attributeName;
    }

    public HtmlAttributeNode(String attributeName, IrNode value) {
        this(attributeName);
        addChild(value);
    }

    public IrNode value() {
        return children.isEmpty() ? null : children.get(0);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.HTML_ATTRIBUTE;
    }

    @Override
    public String toString() {
        return "@" + attributeName;
    }
}
