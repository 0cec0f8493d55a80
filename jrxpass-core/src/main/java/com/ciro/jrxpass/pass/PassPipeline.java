package com.ciro.jrxpass.pass;

import com.ciro.jrxpass.ir.DocumentNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ejecuta los pasos registrados, en orden ascendente, sobre un documento.
 * Un fallo en cualquier paso corta la cadena y se propaga tal cual.
 */
public class PassPipeline {

    private static final Logger log = LoggerFactory.getLogger(PassPipeline.class);

    private final List<IrPass> passes = new ArrayList<>();

    public static PassPipeline withDefaults() {
        return new PassPipeline().add(new HtmlRewritePass());
    }

    public PassPipeline add(IrPass pass) {
        passes.add(pass);
        // sort es estable: a igual orden se respeta el registro
        passes.sort(Comparator.comparingInt(IrPass::getOrder));
        return this;
    }

    public List<IrPass> getPasses() {
        return List.copyOf(passes);
    }

    public void run(DocumentNode document) {
        for (IrPass pass : passes) {
            log.debug("Running {} (order {})", pass.getClass().getSimpleName(), pass.getOrder());
            pass.execute(document);
        }
    }
}
