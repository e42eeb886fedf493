package com.calc.ast;

import com.calc.lexer.TokenType;

import java.util.Optional;

/**
 * Binary operations, grouped by grammar level.
 */
public enum BinaryOperator {
    // Multiplicative
    MULTIPLICATION("*", TokenType.TIMES),
    DIVISION("/", TokenType.DIV),

    // Additive
    SUM("+", TokenType.PLUS),
    SUBTRACTION("-", TokenType.MINUS),

    // Comparison
    GREATER_THAN(">", TokenType.GREATER_THAN),
    GREATER_THAN_OR_EQUAL(">=", TokenType.GREATER_THAN_OR_EQUAL),
    LESS_THAN("<", TokenType.LESS_THAN),
    LESS_THAN_OR_EQUAL("<=", TokenType.LESS_THAN_OR_EQUAL),
    EQUAL("==", TokenType.EQUAL);

    private final String symbol;
    private final TokenType tokenType;

    BinaryOperator(String symbol, TokenType tokenType) {
        this.symbol = symbol;
        this.tokenType = tokenType;
    }

    public String getSymbol() {
        return symbol;
    }

    public TokenType getTokenType() {
        return tokenType;
    }

    public boolean isComparison() {
        return ordinal() >= GREATER_THAN.ordinal();
    }

    public static Optional<BinaryOperator> fromTokenType(TokenType type) {
        for (BinaryOperator operator : values()) {
            if (operator.tokenType == type) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
