package com.calc.ast;

import com.calc.core.Location;

import java.util.Objects;

/**
 * Arithmetic or comparison operation on two operands.
 *
 * @param operator Operation
 * @param left     Left operand
 * @param right    Right operand
 * @param location Location of the operator token
 */
public record BinaryNode(BinaryOperator operator, ParseNode left, ParseNode right, Location location)
        implements ParseNode {

    public BinaryNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }
}
