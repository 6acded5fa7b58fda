package com.csd.formulary.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lossless lexer for spreadsheet formulas. Every character of the input ends up in exactly one
 * token, whitespace included, so {@link #reconstruct(List)} returns the original text for any input.
 */
public class FormulaTokenizer {

    private record Rule(TokenType type, Pattern pattern) {}

    // order matters: first rule that matches at the current position wins
    private static final List<Rule> RULES = List.of(
            new Rule(TokenType.STRING, Pattern.compile("\"(?:\"\"|[^\"])*\"")),
            new Rule(TokenType.NUMBER, Pattern.compile("[0-9]+(?:\\.[0-9]+)?(?:[eE][+-]?[0-9]+)?")),
            new Rule(TokenType.IDENTIFIER, Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*")),
            new Rule(TokenType.LPAREN, Pattern.compile("\\(")),
            new Rule(TokenType.RPAREN, Pattern.compile("\\)")),
            new Rule(TokenType.LBRACKET, Pattern.compile("\\[")),
            new Rule(TokenType.RBRACKET, Pattern.compile("]")),
            new Rule(TokenType.LBRACE, Pattern.compile("\\{")),
            new Rule(TokenType.RBRACE, Pattern.compile("}")),
            new Rule(TokenType.COMMA, Pattern.compile(",")),
            new Rule(TokenType.SEMICOLON, Pattern.compile(";")),
            new Rule(TokenType.OPERATOR, Pattern.compile("[+\\-*/^&=<>!:]+")),
            new Rule(TokenType.WHITESPACE, Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS))
    );

    public List<Token> tokenize(String formula) {
        List<Token> tokens = new ArrayList<>();
        if (formula == null) return tokens;

        int pos = 0;
        int length = formula.length();
        while (pos < length) {
            Token next = null;
            for (Rule rule : RULES) {
                Matcher m = rule.pattern().matcher(formula).region(pos, length);
                if (m.lookingAt() && m.end() > pos) {
                    next = new Token(rule.type(), m.group(), pos, m.end());
                    break;
                }
            }
            if (next == null) {
                // also covers unterminated strings: the lone quote becomes UNKNOWN
                int end = formula.offsetByCodePoints(pos, 1);
                next = new Token(TokenType.UNKNOWN, formula.substring(pos, end), pos, end);
            }
            tokens.add(next);
            pos = next.end();
        }
        return tokens;
    }

    public String reconstruct(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token t : tokens) sb.append(t.text());
        return sb.toString();
    }
}
