package com.ciro.jrxpass.lexer;

import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tokenizer HTML O(N), perezoso y de una sola pasada.
 * Cada llamada a {@link #next()} avanza lo justo para producir un token.
 * Las referencias de carácter (&amp;amp;, &amp;#39;...) se decodifican con jsoup.
 */
public class HtmlTokenizer implements MarkupTokenizer {

    private static final Set<String> RAW_TEXT = Set.of("script", "style");
    private static final Set<String> ESCAPABLE_RAW_TEXT = Set.of("textarea", "title");

    private final String input;
    private final int len;
    private int pos = 0;

    // Dentro de <script>, <style>, <textarea> o <title> el contenido no se parsea como HTML
    private String rawTextTag;

    public HtmlTokenizer(String input) {
        this.input = input == null ? "" : input;
        this.len = this.input.length();
    }

    @Override
    public HtmlToken next() {
        if (rawTextTag != null) {
            HtmlToken raw = readRawText();
            if (raw != null) return raw;
        }

        while (pos < len) {
            if (!startsMarkup(pos)) {
                return readText();
            }
            HtmlToken markup = readMarkup();
            // null: etiqueta ignorada o cortada por el fin de la entrada
            if (markup != null) return markup;
        }
        return HtmlToken.endOfFile();
    }

    // ==============================================================
    // Texto plano
    // ==============================================================

    private HtmlToken readText() {
        int start = pos;
        pos++; // el primer carácter puede ser un '<' que no abre etiqueta
        while (pos < len && !startsMarkup(pos)) {
            pos++;
        }
        return HtmlToken.character(Parser.unescapeEntities(input.substring(start, pos), false));
    }

    private boolean startsMarkup(int i) {
        if (input.charAt(i) != '<' || i + 1 >= len) return false;
        char next = input.charAt(i + 1);
        if (next == '/') return i + 2 < len;
        return isAsciiLetter(next) || next == '!' || next == '?';
    }

    private HtmlToken readMarkup() {
        char next = input.charAt(pos + 1);
        if (next == '!') {
            if (input.startsWith("<!--", pos)) return readComment();
            if (input.regionMatches(true, pos + 2, "doctype", 0, 7)) return readDoctype();
            return readBogusComment(pos + 2);
        }
        if (next == '?') return readBogusComment(pos + 1);
        if (next == '/') return readEndTag();
        return readStartTag();
    }

    // ==============================================================
    // Comentarios y doctype
    // ==============================================================

    private HtmlToken readComment() {
        int start = pos + 4;
        // <!--> y <!---> son comentarios vacíos
        if (input.startsWith(">", start)) {
            pos = start + 1;
            return HtmlToken.comment("");
        }
        if (input.startsWith("->", start)) {
            pos = start + 2;
            return HtmlToken.comment("");
        }

        int end = input.indexOf("-->", start);
        if (end < 0) {
            pos = len;
            return HtmlToken.comment(input.substring(start));
        }
        pos = end + 3;
        return HtmlToken.comment(input.substring(start, end));
    }

    private HtmlToken readDoctype() {
        int start = pos + 9;
        int end = input.indexOf('>', start);
        if (end < 0) {
            pos = len;
            return HtmlToken.doctype(input.substring(start).trim());
        }
        pos = end + 1;
        return HtmlToken.doctype(input.substring(start, end).trim());
    }

    private HtmlToken readBogusComment(int start) {
        int end = input.indexOf('>', start);
        if (end < 0) {
            pos = len;
            return HtmlToken.comment(input.substring(start));
        }
        pos = end + 1;
        return HtmlToken.comment(input.substring(start, end));
    }

    // ==============================================================
    // Etiquetas
    // ==============================================================

    private HtmlToken readEndTag() {
        int i = pos + 2;
        char c = input.charAt(i);
        if (c == '>') {
            // </> no produce nada
            pos = i + 1;
            return null;
        }
        if (!isAsciiLetter(c)) {
            return readBogusComment(i);
        }

        int nameEnd = scanTagName(i);
        String name = input.substring(i, nameEnd);

        // Los "atributos" de una etiqueta de cierre se descartan, respetando comillas
        int close = skipToTagEnd(nameEnd);
        if (close < 0) {
            pos = len;
            return null;
        }
        pos = close + 1;
        return HtmlToken.endTag(name);
    }

    private HtmlToken readStartTag() {
        int i = pos + 1;
        int nameEnd = scanTagName(i);
        String name = input.substring(i, nameEnd);
        i = nameEnd;

        List<TagAttribute> attributes = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        boolean selfClosing = false;

        while (true) {
            i = skipWhitespace(i);
            if (i >= len) {
                pos = len;
                return null;
            }

            char c = input.charAt(i);
            if (c == '>') {
                i++;
                break;
            }
            if (c == '/') {
                if (i + 1 < len && input.charAt(i + 1) == '>') {
                    selfClosing = true;
                    i += 2;
                    break;
                }
                i++;
                continue;
            }

            // Nombre del atributo (el primer carácter puede ser '=')
            int attrStart = i;
            i++;
            while (i < len && !isWhitespace(input.charAt(i)) && input.charAt(i) != '/'
                    && input.charAt(i) != '>' && input.charAt(i) != '=') {
                i++;
            }
            String attrName = input.substring(attrStart, i);

            String value = "";
            int afterName = skipWhitespace(i);
            if (afterName < len && input.charAt(afterName) == '=') {
                i = skipWhitespace(afterName + 1);
                if (i >= len) {
                    pos = len;
                    return null;
                }

                char quote = input.charAt(i);
                if (quote == '"' || quote == '\'') {
                    int closeQuote = input.indexOf(quote, i + 1);
                    if (closeQuote < 0) {
                        pos = len;
                        return null;
                    }
                    value = input.substring(i + 1, closeQuote);
                    i = closeQuote + 1;
                } else {
                    int valueStart = i;
                    while (i < len && !isWhitespace(input.charAt(i)) && input.charAt(i) != '>') {
                        i++;
                    }
                    value = input.substring(valueStart, i);
                }
                value = Parser.unescapeEntities(value, true);
            }

            // Atributo repetido: gana el primero
            if (seen.add(attrName.toLowerCase(Locale.ROOT))) {
                attributes.add(new TagAttribute(attrName, value));
            }
        }

        pos = i;

        // Las etiquetas HTML5 vacías (como <input>) siempre se reportan auto-cerradas
        if (VoidElements.isVoid(name)) {
            selfClosing = true;
        }

        String lower = name.toLowerCase(Locale.ROOT);
        if (!selfClosing && (RAW_TEXT.contains(lower) || ESCAPABLE_RAW_TEXT.contains(lower))) {
            rawTextTag = lower;
        }
        return HtmlToken.startTag(name, attributes, selfClosing);
    }

    private HtmlToken readRawText() {
        String tag = rawTextTag;
        rawTextTag = null;

        int end = len;
        int i = pos;
        while ((i = input.indexOf("</", i)) >= 0) {
            int nameEnd = i + 2 + tag.length();
            if (input.regionMatches(true, i + 2, tag, 0, tag.length())
                    && (nameEnd >= len || isTagNameTerminator(input.charAt(nameEnd)))) {
                end = i;
                break;
            }
            i += 2;
        }

        if (end == pos) return null;

        String text = input.substring(pos, end);
        pos = end;
        return HtmlToken.character(ESCAPABLE_RAW_TEXT.contains(tag) ? Parser.unescapeEntities(text, false) : text);
    }

    private int scanTagName(int i) {
        while (i < len && !isTagNameTerminator(input.charAt(i))) {
            i++;
        }
        return i;
    }

    private int skipToTagEnd(int i) {
        boolean inSingleQuote = false;
        boolean inDoubleQuote = false;
        while (i < len) {
            char c = input.charAt(i);
            if (c == '"' && !inSingleQuote) inDoubleQuote = !inDoubleQuote;
            else if (c == '\'' && !inDoubleQuote) inSingleQuote = !inSingleQuote;
            else if (c == '>' && !inSingleQuote && !inDoubleQuote) return i;
            i++;
        }
        return -1;
    }

    private int skipWhitespace(int i) {
        while (i < len && isWhitespace(input.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isTagNameTerminator(char c) {
        return isWhitespace(c) || c == '/' || c == '>';
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
