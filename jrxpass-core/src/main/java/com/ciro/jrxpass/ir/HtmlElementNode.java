package com.ciro.jrxpass.ir;

public class HtmlElementNode extends IrNode {
    public final String tagName;

    public HtmlElementNode(String tagName) {
        this.tagName = tagName;
    }

    public boolean hasTagName(String name) {
        return tagName.equalsIgnoreCase(name);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.HTML_ELEMENT;
    }

    @Override
    public String toString() {
        return "<" + tagName + ">";
    }
}
