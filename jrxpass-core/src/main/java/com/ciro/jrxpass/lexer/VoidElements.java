package com.ciro.jrxpass.lexer;

import java.util.Locale;
import java.util.Set;

/**
 * Elementos HTML5 que se cierran solos: {@code <img>} equivale a {@code <img/>}
 * y nunca tienen descendientes.
 */
public final class VoidElements {

    private static final Set<String> NAMES = Set.of(
        "area", "base", "br", "col", "embed", "hr", "img", "input",
        "link", "meta", "param", "source", "track", "wbr"
    );

    private VoidElements() {}

    public static boolean isVoid(String tagName) {
        return tagName != null && NAMES.contains(tagName.toLowerCase(Locale.ROOT));
    }

    public static Set<String> names() {
        return NAMES;
    }
}
