package com.ciro.jrxpass.lexer;

/** Par (nombre, valor) tal como lo reporta el tokenizer, con el valor ya decodificado. */
public record TagAttribute(String name, String value) {}
