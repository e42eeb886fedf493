package com.calc.ast;

import com.calc.core.Location;

/**
 * Node of the syntax tree built by the parser.
 * <p>
 * Nodes are immutable and own their children exclusively.
 */
public interface ParseNode {

    /**
     * Location of the token that created this node. For binary operations
     * this is the operator token.
     */
    Location location();
}
