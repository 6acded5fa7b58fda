package com.csd.formulary.formula;

public enum TokenType {
    IDENTIFIER,
    STRING,
    NUMBER,
    OPERATOR,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    COMMA,
    SEMICOLON,
    WHITESPACE,
    UNKNOWN;

    public boolean isSeparator() {
        return this == COMMA || this == SEMICOLON;
    }

    public boolean opensGroup() {
        return this == LPAREN || this == LBRACKET || this == LBRACE;
    }

    public boolean closesGroup() {
        return this == RPAREN || this == RBRACKET || this == RBRACE;
    }
}
