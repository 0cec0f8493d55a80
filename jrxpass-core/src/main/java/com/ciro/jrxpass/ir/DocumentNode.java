package com.ciro.jrxpass.ir;

public class DocumentNode extends IrNode {

    @Override
    public NodeKind kind() {
        return NodeKind.DOCUMENT;
    }
}
