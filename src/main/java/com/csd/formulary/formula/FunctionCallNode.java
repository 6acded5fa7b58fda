package com.csd.formulary.formula;

import java.util.List;

/**
 * {@code NAME ws* ( arg , arg ; ... )}. Each argument slice keeps its trailing separator token,
 * except the last one. {@code close} is null when the input ended before the matching paren.
 */
public record FunctionCallNode(Token name,
                               List<Token> preParenWhitespace,
                               Token open,
                               List<List<Node>> args,
                               Token close) implements Node {

    public FunctionCallNode {
        preParenWhitespace = List.copyOf(preParenWhitespace);
        args = args.stream().map(List::copyOf).toList();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public String toText() {
        StringBuilder sb = new StringBuilder(name.text());
        preParenWhitespace.forEach(ws -> sb.append(ws.text()));
        sb.append(open.text());
        for (List<Node> arg : args) {
            for (Node node : arg) sb.append(node.toText());
        }
        if (close != null) sb.append(close.text());
        return sb.toString();
    }

    public FunctionCallNode withName(Token newName) {
        return new FunctionCallNode(newName, preParenWhitespace, open, args, close);
    }

    public FunctionCallNode withArgs(List<List<Node>> newArgs) {
        return new FunctionCallNode(name, preParenWhitespace, open, newArgs, close);
    }
}
