package com.ciro.jrxpass.ir;

import java.util.List;

public final class HtmlTextNode extends IrNode {
    public final String content;

    public HtmlTextNode(String content) {
        super(List.of());
        this.content = content;
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.HTML_TEXT;
    }

    @Override
    public String toString() {
        return "\"" + content + "\"";
    }
}
