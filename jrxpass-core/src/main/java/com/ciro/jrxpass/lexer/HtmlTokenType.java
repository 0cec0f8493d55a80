package com.ciro.jrxpass.lexer;

public enum HtmlTokenType {
    CHARACTER,
    START_TAG,
    END_TAG,
    COMMENT,
    DOCTYPE,
    END_OF_FILE
}
