package com.csd.formulary.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renames identifiers in formula text according to a rename map while respecting names bound by
 * {@code LET} and {@code LAMBDA}. Output is byte-identical to the input outside renamed spans, and
 * malformed input passes through as far as it could be parsed.
 */
public class FormulaRefactorer {

    private final Map<String, String> renameMap;
    private final FormulaTokenizer tokenizer = new FormulaTokenizer();

    public FormulaRefactorer(Map<String, String> renameMap) {
        this.renameMap = Map.copyOf(renameMap);
    }

    public String refactor(String formula) {
        if (formula == null || renameMap.isEmpty()) return formula;
        List<Node> nodes = new FormulaParser(tokenizer.tokenize(formula)).parse();
        return FormulaParser.serialize(transformAll(nodes, Scope.empty()));
    }

    List<Node> transformAll(List<Node> nodes, Scope scope) {
        List<Node> out = new ArrayList<>(nodes.size());
        for (Node node : nodes) out.add(transform(node, scope));
        return out;
    }

    Node transform(Node node, Scope scope) {
        return node.accept(new Node.Visitor<Node>() {
            @Override
            public Node visitToken(TokenNode leaf) {
                return renameToken(leaf, scope);
            }

            @Override
            public Node visitCall(FunctionCallNode call) {
                String callee = call.name().text().toUpperCase(Locale.ROOT);
                if ("LET".equals(callee)) return transformLet(call, scope);
                if ("LAMBDA".equals(callee)) return transformLambda(call, scope);
                return transformCall(call, scope);
            }
        });
    }

    private TokenNode renameToken(TokenNode leaf, Scope scope) {
        if (!leaf.isIdentifier()) return leaf;
        String name = leaf.token().text();
        if (scope.contains(name)) return leaf;
        String alias = renameMap.get(name);
        return alias == null ? leaf : new TokenNode(leaf.token().withText(alias));
    }

    private FunctionCallNode transformCall(FunctionCallNode call, Scope scope) {
        TokenNode name = renameToken(new TokenNode(call.name()), scope);
        List<List<Node>> args = new ArrayList<>();
        for (List<Node> arg : call.args()) {
            args.add(transformAll(arg, scope));
        }
        return call.withName(name.token()).withArgs(args);
    }

    // LET(name1, value1, ..., nameN, valueN, expr): value_i sees names 1..i-1 only
    private FunctionCallNode transformLet(FunctionCallNode call, Scope scope) {
        List<List<Node>> source = call.args();
        List<List<Node>> args = new ArrayList<>();
        Scope current = scope;
        int last = source.size() - 1;
        int i = 0;
        while (i < source.size()) {
            if (i == last) {
                args.add(transformAll(source.get(i), current));
                break;
            }
            List<Node> declaration = source.get(i);
            args.add(declaration);
            if (i + 1 < source.size()) {
                args.add(transformAll(source.get(i + 1), current));
                current = current.with(declaredName(declaration));
            }
            i += 2;
        }
        return call.withArgs(args);
    }

    // LAMBDA(param1, ..., paramK, expr): every param is bound in expr
    private FunctionCallNode transformLambda(FunctionCallNode call, Scope scope) {
        List<List<Node>> source = call.args();
        List<List<Node>> args = new ArrayList<>();
        Scope current = scope;
        for (int i = 0; i < source.size() - 1; i++) {
            args.add(source.get(i));
            current = current.with(declaredName(source.get(i)));
        }
        if (!source.isEmpty()) {
            args.add(transformAll(source.get(source.size() - 1), current));
        }
        return call.withArgs(args);
    }

    private static String declaredName(List<Node> slice) {
        for (Node node : slice) {
            if (node instanceof TokenNode leaf && leaf.isIdentifier()) {
                return leaf.token().text();
            }
        }
        return null;
    }
}
