package com.ciro.jrxpass.pass;

import com.ciro.jrxpass.lexer.HtmlTokenType;

import java.util.List;

/**
 * Fallo fatal de la reescritura HTML. Aborta el template completo: un árbol
 * reconstruido a medias no sirve para generar código.
 */
public class RewriteException extends RuntimeException {

    public enum Reason {
        UNBALANCED_CLOSE,
        ATTRIBUTE_OUTSIDE_ELEMENT,
        UNBALANCED_TREE,
        UNSUPPORTED_TOKEN
    }

    private final Reason reason;

    public RewriteException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    static RewriteException unbalancedClose(String endTag, String openElement) {
        String detail = openElement == null
            ? "no element is open"
            : "the innermost open element is <" + openElement + ">";
        return new RewriteException(Reason.UNBALANCED_CLOSE,
            "Unbalanced end tag </" + endTag + ">: " + detail);
    }

    static RewriteException attributeOutsideElement(String attributeName) {
        return new RewriteException(Reason.ATTRIBUTE_OUTSIDE_ELEMENT,
            "Attribute '" + attributeName + "' appears outside of an HTML element");
    }

    static RewriteException unbalancedTree(List<String> unclosed) {
        return new RewriteException(Reason.UNBALANCED_TREE,
            "Unbalanced markup: elements left open " + unclosed);
    }

    static RewriteException unsupportedToken(HtmlTokenType type) {
        return new RewriteException(Reason.UNSUPPORTED_TOKEN, "Unsupported token type: " + type);
    }
}
