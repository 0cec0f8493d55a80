package com.ciro.jrxpass.pass;

import com.ciro.jrxpass.ir.DocumentNode;
import com.ciro.jrxpass.ir.IrPrinter;
import com.ciro.jrxpass.lexer.HtmlTokenizer;
import com.ciro.jrxpass.lexer.TokenizerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reescribe el IR estándar a una forma con estructura HTML: en vez de tratar el HTML
 * como contenido opaco, lo convierte en nodos de elemento, atributo y texto.
 */
public class HtmlRewritePass implements IrPass {

    private static final Logger log = LoggerFactory.getLogger(HtmlRewritePass.class);

    private final HtmlTreeBuilder builder;

    public HtmlRewritePass() {
        this(HtmlTokenizer::new);
    }

    public HtmlRewritePass(TokenizerFactory tokenizerFactory) {
        this.builder = new HtmlTreeBuilder(tokenizerFactory);
    }

    // Lo antes posible
    @Override
    public int getOrder() {
        return Integer.MIN_VALUE;
    }

    @Override
    public void execute(DocumentNode document) {
        RewriteWalker walker = new RewriteWalker(builder);
        walker.visit(document);

        log.debug("HTML rewrite done, {} node(s) rebuilt", walker.getRewrittenNodes());
        if (log.isTraceEnabled()) {
            log.trace("Rewritten IR:\n{}", IrPrinter.print(document));
        }
    }
}
