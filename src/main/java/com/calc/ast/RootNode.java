package com.calc.ast;

import com.calc.core.Location;

import java.util.List;

/**
 * Top of the tree: the statements of a program in source order.
 */
public record RootNode(List<ParseNode> statements, Location location) implements ParseNode {

    public RootNode {
        statements = List.copyOf(statements);
    }

    public static RootNode empty() {
        return new RootNode(List.of(), Location.START);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }
}
