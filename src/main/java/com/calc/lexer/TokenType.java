package com.calc.lexer;

/**
 * Token types produced by the {@link Lexer}.
 */
public enum TokenType {
    // Identifiers and literals
    IDENTIFIER,
    NUMBER,

    // Arithmetic operators
    PLUS,
    MINUS,
    TIMES,
    DIV,

    // Comparison operators
    GREATER_THAN,
    GREATER_THAN_OR_EQUAL,
    LESS_THAN,
    LESS_THAN_OR_EQUAL,
    EQUAL,

    // Assignment
    ASSIGN,

    // Delimiters
    LEFT_PAREN,
    RIGHT_PAREN,

    // Special, never emitted by the lexer
    END_OF_INPUT
}
