package com.ciro.jrxpass.ir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Nodo base del IR. Cada nodo es dueño exclusivo de su lista ordenada de hijos.
 * Las hojas ({@link HtmlTextNode}, {@link IrToken}) usan una lista inmutable vacía.
 */
public abstract class IrNode {

    protected final List<IrNode> children;

    // Solo las clases de este paquete pueden extender el modelo
    IrNode() {
        this.children = new ArrayList<>();
    }

    IrNode(List<IrNode> children) {
        this.children = children;
    }

    public abstract NodeKind kind();

    public List<IrNode> getChildren() {
        return children;
    }

    public boolean isLeaf() {
        return false;
    }

    public void addChild(IrNode child) {
        if (child == null) throw new IllegalArgumentException("child must not be null");
        children.add(child);
    }

    public void replaceChildren(Collection<? extends IrNode> replacement) {
        List<IrNode> copy = new ArrayList<>(replacement);
        children.clear();
        children.addAll(copy);
    }

    @Override
    public String toString() {
        return kind().name();
    }
}
