package com.ciro.jrxpass.ir;

/**
 * Conjunto cerrado de tipos de nodo del IR.
 * El builder y el printer hacen switch exhaustivo sobre este enum.
 */
public enum NodeKind {
    DOCUMENT,
    METHOD,
    HTML_CONTENT,               // Texto HTML opaco, aún sin estructurar
    HTML_ELEMENT,
    HTML_ATTRIBUTE,
    HTML_ATTRIBUTE_VALUE,
    EXPRESSION_ATTRIBUTE_VALUE,
    HTML_TEXT,                  // Hoja de texto ya reconstruida
    EXPRESSION,
    STATEMENT,
    TOKEN
}
