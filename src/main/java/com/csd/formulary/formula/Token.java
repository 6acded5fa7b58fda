package com.csd.formulary.formula;

/**
 * A lexeme with its half-open source span {@code [start, end)}.
 */
public record Token(TokenType type, String text, int start, int end) {

    public boolean is(TokenType other) {
        return type == other;
    }

    /** Same span and kind, different text. */
    public Token withText(String replacement) {
        return new Token(type, replacement, start, end);
    }
}
