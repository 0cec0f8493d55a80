package com.ciro.jrxpass.ir;

/**
 * Expresión embebida en el template ({{ user.name }}). Opaca para el paso HTML.
 */
public class ExpressionNode extends IrNode {

    public ExpressionNode(String expression) {
        addChild(new IrToken(IrToken.Kind.EXPRESSION, expression));
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXPRESSION;
    }
}
