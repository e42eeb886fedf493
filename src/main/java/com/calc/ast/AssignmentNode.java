package com.calc.ast;

import com.calc.core.Location;

import java.util.Objects;

/**
 * Assignment of a value to a symbol.
 *
 * @param name     Target symbol
 * @param value    Right-hand side
 * @param location Location of the {@code =} token
 */
public record AssignmentNode(String name, ParseNode value, Location location) implements ParseNode {

    public AssignmentNode {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}
