package com.ciro.jrxpass.ir;

/**
 * Recorrido en profundidad del IR. Las subclases sobrescriben {@link #visitDefault}
 * para decidir qué hacer antes o después de visitar los hijos.
 */
public abstract class IrWalker {

    public void visit(IrNode node) {
        visitDefault(node);
    }

    protected void visitDefault(IrNode node) {
        for (IrNode child : node.getChildren()) {
            visit(child);
        }
    }
}
