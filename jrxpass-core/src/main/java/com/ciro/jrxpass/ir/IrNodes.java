package com.ciro.jrxpass.ir;

import java.util.ArrayList;
import java.util.List;

public final class IrNodes {

    private IrNodes() {}

    /** Primer método generado del documento, o null si no hay ninguno. */
    public static MethodNode findPrimaryMethod(DocumentNode document) {
        List<IrNode> pending = new ArrayList<>(document.getChildren());
        while (!pending.isEmpty()) {
            IrNode node = pending.remove(0);
            if (node instanceof MethodNode method) return method;
            pending.addAll(0, node.getChildren());
        }
        return null;
    }

    public static boolean containsKind(IrNode root, NodeKind kind) {
        if (root.kind() == kind) return true;
        for (IrNode child : root.getChildren()) {
            if (containsKind(child, kind)) return true;
        }
        return false;
    }
}
