package com.csd.formulary.formula;

public record TokenNode(Token token) implements Node {

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitToken(this);
    }

    @Override
    public String toText() {
        return token.text();
    }

    public boolean isIdentifier() {
        return token.is(TokenType.IDENTIFIER);
    }
}
