package com.ciro.jrxpass.lexer;

import java.util.List;

/**
 * Token HTML. En START_TAG / END_TAG {@code data} es el nombre de la etiqueta;
 * en CHARACTER, COMMENT y DOCTYPE es el contenido.
 */
public record HtmlToken(HtmlTokenType type, String data, List<TagAttribute> attributes, boolean selfClosing) {

    private static final HtmlToken EOF = new HtmlToken(HtmlTokenType.END_OF_FILE, "", List.of(), false);

    public HtmlToken {
        attributes = List.copyOf(attributes);
    }

    public static HtmlToken character(String text) {
        return new HtmlToken(HtmlTokenType.CHARACTER, text, List.of(), false);
    }

    public static HtmlToken startTag(String name, List<TagAttribute> attributes, boolean selfClosing) {
        return new HtmlToken(HtmlTokenType.START_TAG, name, attributes, selfClosing);
    }

    public static HtmlToken endTag(String name) {
        return new HtmlToken(HtmlTokenType.END_TAG, name, List.of(), false);
    }

    public static HtmlToken comment(String text) {
        return new HtmlToken(HtmlTokenType.COMMENT, text, List.of(), false);
    }

    public static HtmlToken doctype(String text) {
        return new HtmlToken(HtmlTokenType.DOCTYPE, text, List.of(), false);
    }

    public static HtmlToken endOfFile() {
        return EOF;
    }

    public String name() {
        return data;
    }
}
