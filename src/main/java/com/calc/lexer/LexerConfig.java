package com.calc.lexer;

import java.util.Map;

/**
 * Character classes and operator symbols recognized by the lexer.
 */
public final class LexerConfig {

    private LexerConfig() {
    }

    /**
     * Single-character tokens.
     */
    public static final Map<Character, TokenType> SINGLE_CHAR_TOKENS = Map.of(
            Operators.LEFT_PAREN, TokenType.LEFT_PAREN,
            Operators.RIGHT_PAREN, TokenType.RIGHT_PAREN,
            Operators.PLUS, TokenType.PLUS,
            Operators.MINUS, TokenType.MINUS,
            Operators.TIMES, TokenType.TIMES,
            Operators.DIV, TokenType.DIV
    );

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char PLUS = '+';
        public static final char MINUS = '-';
        public static final char TIMES = '*';
        public static final char DIV = '/';
        public static final char EQUALS = '=';
        public static final char GREATER = '>';
        public static final char LESS = '<';
        public static final char UNDERSCORE = '_';
        public static final char NEWLINE = '\n';

        private Operators() {
        }
    }

    public static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    public static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == Operators.UNDERSCORE;
    }

    public static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
