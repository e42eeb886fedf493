package com.calc.ast;

import com.calc.core.Location;

/**
 * Number literal.
 */
public record NumberNode(double value, Location location) implements ParseNode {
}
