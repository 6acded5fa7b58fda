package com.csd.formulary.formula;

/**
 * Concrete syntax tree node: either a plain token or a function call.
 * Traversals go through {@link Visitor} so each site handles both kinds.
 */
public sealed interface Node permits TokenNode, FunctionCallNode {

    <R> R accept(Visitor<R> visitor);

    /** Source text of this node, byte-identical to what was parsed. */
    String toText();

    interface Visitor<R> {
        R visitToken(TokenNode node);

        R visitCall(FunctionCallNode node);
    }
}
