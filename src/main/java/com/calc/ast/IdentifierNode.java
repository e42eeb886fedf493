package com.calc.ast;

import com.calc.core.Location;

/**
 * Reference to a symbol.
 */
public record IdentifierNode(String name, Location location) implements ParseNode {
}
