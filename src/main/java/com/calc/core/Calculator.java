package com.calc.core;

import com.calc.ast.RootNode;
import com.calc.config.CalculatorConfig;
import com.calc.eval.EvaluationContext;
import com.calc.eval.Evaluator;
import com.calc.lexer.Lexer;
import com.calc.lexer.Token;
import com.calc.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleConsumer;

/**
 * Facade running source text through lexer, parser and evaluator.
 * <p>
 * Each stage finishes before the next one starts. The first error of any
 * stage is thrown unchanged as a {@link com.calc.exception.SourceException}.
 */
public class Calculator {

    private static final Logger log = LoggerFactory.getLogger(Calculator.class);

    private final CalculatorConfig config;
    private final Lexer lexer;
    private final Parser parser;
    private final Evaluator evaluator;

    public Calculator() {
        this(CalculatorConfig.defaults());
    }

    public Calculator(CalculatorConfig config) {
        this.config = config;
        this.lexer = new Lexer();
        this.parser = new Parser(config.statementMode());
        this.evaluator = new Evaluator();
    }

    public List<Token> tokenize(String source) {
        List<Token> tokens = lexer.tokenize(source);
        log.debug("Lexed {} token(s)", tokens.size());
        return tokens;
    }

    public RootNode parse(String source) {
        RootNode root = parser.parse(tokenize(source));
        log.debug("Parsed {} statement(s)", root.statements().size());
        return root;
    }

    /**
     * Create a context holding {@code PI} and the configured constants.
     */
    public EvaluationContext newContext() {
        return new EvaluationContext(config.constants());
    }

    /**
     * Evaluate source text in a fresh context.
     *
     * @return Value of each statement in source order
     */
    public List<Double> evaluate(String source) {
        return evaluate(source, newContext());
    }

    /**
     * Evaluate source text against an existing context, keeping its symbols.
     */
    public List<Double> evaluate(String source, EvaluationContext context) {
        List<Double> results = new ArrayList<>();
        evaluate(source, context, results::add);
        return results;
    }

    /**
     * Evaluate source text, handing each statement value to {@code listener}
     * as soon as it is computed.
     */
    public void evaluate(String source, EvaluationContext context, DoubleConsumer listener) {
        RootNode root = parse(source);
        evaluator.run(root, context, listener);
    }

    public CalculatorConfig getConfig() {
        return config;
    }
}
