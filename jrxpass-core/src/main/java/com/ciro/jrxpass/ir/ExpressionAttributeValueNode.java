package com.ciro.jrxpass.ir;

public class ExpressionAttributeValueNode extends IrNode {

    public ExpressionAttributeValueNode(String expression) {
        addChild(new IrToken(IrToken.Kind.EXPRESSION, expression));
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXPRESSION_ATTRIBUTE_VALUE;
    }
}
