package com.ciro.jrxpass.ir;

/**
 * Bloque de control (if / each). Sus hijos forman el cuerpo del bloque y se
 * reescriben por separado, antes que el padre.
 */
public class StatementNode extends IrNode {
    public final String code;

    public StatementNode(String code) {
        this.code = code;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STATEMENT;
    }

    @Override
    public String toString() {
        return "STATEMENT " + code;
    }
}
