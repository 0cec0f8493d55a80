package com.ciro.jrxpass.pass;

import com.ciro.jrxpass.ir.HtmlAttributeNode;
import com.ciro.jrxpass.ir.HtmlAttributeValueNode;
import com.ciro.jrxpass.lexer.TagAttribute;

public final class AttributeNodes {

    private AttributeNodes() {}

    /** Atributo -> valor literal -> token HTML con el valor reportado. */
    public static HtmlAttributeNode create(TagAttribute attribute) {
        return new HtmlAttributeNode(attribute.name(), new HtmlAttributeValueNode(attribute.value()));
    }
}
