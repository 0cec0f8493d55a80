package com.ciro.jrxpass.ir;

/**
 * Frontera de un método generado. Para el paso de reescritura es el "nivel raíz".
 */
public class MethodNode extends IrNode {
    public final String methodName;

    public MethodNode(String methodName) {
        this.methodName = methodName;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.METHOD;
    }

    @Override
    public String toString() {
        return "METHOD " + methodName;
    }
}
