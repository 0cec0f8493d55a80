package com.ciro.jrxpass.lexer;

@FunctionalInterface
public interface TokenizerFactory {
    MarkupTokenizer create(String text);
}
