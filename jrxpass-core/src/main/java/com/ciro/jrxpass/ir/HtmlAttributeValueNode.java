package com.ciro.jrxpass.ir;

public class HtmlAttributeValueNode extends IrNode {

    public HtmlAttributeValueNode(String literal) {
        addChild(new IrToken(IrToken.Kind.HTML, literal));
    }

    @Override
    public NodeKind kind() {
        return NodeKind.HTML_ATTRIBUTE_VALUE;
    }
}
