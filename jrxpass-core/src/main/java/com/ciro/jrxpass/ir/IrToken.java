package com.ciro.jrxpass.ir;

import java.util.List;

public final class IrToken extends IrNode {

    public enum Kind {
        HTML,
        EXPRESSION
    }

    public final Kind tokenKind;
    public final String content;

    public IrToken(Kind tokenKind, String content) {
        super(List.of());
        this.tokenKind = tokenKind;
        this.content = content;
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TOKEN;
    }

    @Override
    public String toString() {
        return tokenKind + " " + content;
    }
}
