package com.ciro.jrxpass.pass;

import com.ciro.jrxpass.ir.DocumentNode;

/**
 * Paso de optimización sobre el IR de un template. Los pasos se ejecutan en
 * orden ascendente de {@link #getOrder()}.
 */
public interface IrPass {

    default int getOrder() {
        return 0;
    }

    void execute(DocumentNode document);
}
