package com.calc.eval;

import com.calc.ast.AssignmentNode;
import com.calc.ast.BinaryNode;
import com.calc.ast.BinaryOperator;
import com.calc.ast.IdentifierNode;
import com.calc.ast.NumberNode;
import com.calc.ast.ParseNode;
import com.calc.ast.RootNode;
import com.calc.exception.EvaluationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleConsumer;

/**
 * Tree-walking evaluator.
 * <p>
 * Comparisons yield {@code 1.0} for true and {@code 0.0} for false. Equality
 * holds when the operands differ by less than {@link #EPSILON}.
 */
public class Evaluator {

    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    /**
     * Machine epsilon of {@code double}.
     */
    public static final double EPSILON = Math.ulp(1.0);

    /**
     * Evaluate every statement of {@code root} in a fresh context.
     *
     * @return Value of each statement in source order
     */
    public List<Double> run(RootNode root) {
        return run(root, new EvaluationContext());
    }

    public List<Double> run(RootNode root, EvaluationContext context) {
        List<Double> results = new ArrayList<>(root.statements().size());
        run(root, context, results::add);
        return results;
    }

    /**
     * Evaluate every statement of {@code root} against one context, handing
     * each value to {@code listener} as soon as it is computed. Stops at the
     * first failing statement.
     *
     * @throws EvaluationException from the first failing statement
     */
    public void run(RootNode root, EvaluationContext context, DoubleConsumer listener) {
        log.debug("Evaluating {} statement(s)", root.statements().size());
        for (ParseNode statement : root.statements()) {
            double value = evaluate(statement, context);
            log.debug("Statement at {} = {}", statement.location(), value);
            listener.accept(value);
        }
    }

    /**
     * Evaluate a single node.
     *
     * @throws EvaluationException for unknown symbols and unsupported nodes
     */
    public double evaluate(ParseNode node, EvaluationContext context) {
        if (node instanceof NumberNode number) {
            return number.value();
        }
        if (node instanceof BinaryNode binary) {
            double left = evaluate(binary.left(), context);
            double right = evaluate(binary.right(), context);
            return apply(binary.operator(), left, right);
        }
        if (node instanceof IdentifierNode identifier) {
            return context.getSymbols().lookup(identifier.name())
                    .orElseThrow(() -> EvaluationException.symbolNotFound(identifier.name(), identifier.location()));
        }
        if (node instanceof AssignmentNode assignment) {
            double value = evaluate(assignment.value(), context);
            context.getSymbols().assign(assignment.name(), value);
            return value;
        }
        throw EvaluationException.unimplemented("Eval for type " + describe(node));
    }

    private double apply(BinaryOperator operator, double left, double right) {
        return switch (operator) {
            case SUM -> left + right;
            case SUBTRACTION -> left - right;
            case MULTIPLICATION -> left * right;
            case DIVISION -> left / right;
            case GREATER_THAN -> truth(left > right);
            case GREATER_THAN_OR_EQUAL -> truth(left >= right);
            case LESS_THAN -> truth(left < right);
            case LESS_THAN_OR_EQUAL -> truth(left <= right);
            case EQUAL -> truth(Math.abs(left - right) < EPSILON);
        };
    }

    private static double truth(boolean value) {
        return value ? 1.0 : 0.0;
    }

    private static String describe(ParseNode node) {
        return node == null ? "null" : node.getClass().getSimpleName();
    }
}
