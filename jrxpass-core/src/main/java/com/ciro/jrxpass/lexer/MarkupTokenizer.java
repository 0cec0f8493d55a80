package com.ciro.jrxpass.lexer;

/**
 * Secuencia perezosa y de una sola pasada de tokens HTML sobre un buffer de texto.
 * Una vez devuelto {@link HtmlTokenType#END_OF_FILE}, sigue devolviéndolo.
 */
public interface MarkupTokenizer {
    HtmlToken next();
}
