package com.ciro.jrxpass.pass;

import com.ciro.jrxpass.ir.IrNode;
import com.ciro.jrxpass.ir.IrWalker;
import com.ciro.jrxpass.ir.NodeKind;

/**
 * Visita los nodos y luego los reescribe (post-orden): el árbol se reconstruye de
 * abajo hacia arriba. Un nodo se reescribe si alguno de sus hijos directos es HTML opaco.
 *
 * <p>Solo los bloques anidan contenido, y el cuerpo de cada bloque debe traer HTML bien
 * anidado. Por eso, al encontrar un contenedor de HTML, sus hijos juntos forman un árbol
 * bien formado.
 */
class RewriteWalker extends IrWalker {

    private final HtmlTreeBuilder builder;
    private int rewrittenNodes;

    RewriteWalker(HtmlTreeBuilder builder) {
        this.builder = builder;
    }

    @Override
    protected void visitDefault(IrNode node) {
        boolean foundHtml = false;
        for (IrNode child : node.getChildren()) {
            visit(child);
            if (child.kind() == NodeKind.HTML_CONTENT) {
                foundHtml = true;
            }
        }

        if (foundHtml) {
            builder.rebuild(node);
            rewrittenNodes++;
        }
    }

    int getRewrittenNodes() {
        return rewrittenNodes;
    }
}
