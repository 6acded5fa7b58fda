package com.csd.formulary.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser producing a flat node list where only function calls get structure.
 * The one decision it makes is call versus bare identifier: an identifier is a call when the next
 * non-whitespace token is {@code (}. Never throws; input that ends early yields a call without a
 * closing paren.
 */
public class FormulaParser {

    private final List<Token> tokens;
    private int pos;

    public FormulaParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static List<Node> parse(String formula) {
        return new FormulaParser(new FormulaTokenizer().tokenize(formula)).parse();
    }

    public List<Node> parse() {
        List<Node> nodes = new ArrayList<>();
        while (pos < tokens.size()) {
            nodes.add(parseNext());
        }
        return nodes;
    }

    public static String serialize(List<Node> nodes) {
        StringBuilder sb = new StringBuilder();
        for (Node node : nodes) sb.append(node.toText());
        return sb.toString();
    }

    private Node parseNext() {
        Token token = tokens.get(pos);
        if (token.is(TokenType.IDENTIFIER)) {
            int lookahead = pos + 1;
            while (lookahead < tokens.size() && tokens.get(lookahead).is(TokenType.WHITESPACE)) {
                lookahead++;
            }
            if (lookahead < tokens.size() && tokens.get(lookahead).is(TokenType.LPAREN)) {
                return parseCall(lookahead);
            }
        }
        pos++;
        return new TokenNode(token);
    }

    private FunctionCallNode parseCall(int openIndex) {
        Token name = tokens.get(pos++);
        List<Token> whitespace = new ArrayList<>(tokens.subList(pos, openIndex));
        pos = openIndex;
        Token open = tokens.get(pos++);

        List<List<Node>> args = new ArrayList<>();
        List<Node> current = new ArrayList<>();
        boolean sawSeparator = false;
        int depth = 0; // bare (, [ and { opened inside the current argument
        Token close = null;

        while (pos < tokens.size()) {
            Token t = tokens.get(pos);
            if (depth == 0 && t.is(TokenType.RPAREN)) {
                close = t;
                pos++;
                break;
            }
            if (depth == 0 && t.type().isSeparator()) {
                current.add(new TokenNode(t));
                pos++;
                args.add(current);
                current = new ArrayList<>();
                sawSeparator = true;
                continue;
            }
            Node node = parseNext();
            if (node instanceof TokenNode leaf) {
                if (leaf.token().type().opensGroup()) {
                    depth++;
                } else if (leaf.token().type().closesGroup() && depth > 0) {
                    depth--;
                }
            }
            current.add(node);
        }

        if (!current.isEmpty() || sawSeparator) {
            args.add(current);
        }
        return new FunctionCallNode(name, whitespace, open, args, close);
    }
}
