package com.calc.lexer;

import com.calc.core.Location;
import com.calc.exception.ErrorKind;
import com.calc.exception.LexerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Lexer.
 */
class LexerTest {

    private final Lexer lexer = new Lexer();

    // =====================================================================
    // Tokens
    // =====================================================================

    @Test
    @DisplayName("Empty and blank input produce no tokens")
    void emptyInputProducesNoTokens() {
        assertTrue(lexer.tokenize("").isEmpty());
        assertTrue(lexer.tokenize("  \t\n ").isEmpty());
    }

    @Test
    @DisplayName("Number literal is split from the following operator")
    void numberIsSplitFromOperator() {
        List<Token> tokens = lexer.tokenize("3.1416*2");

        assertEquals(List.of(
                new Token(TokenType.NUMBER, "3.1416", 0, 0),
                new Token(TokenType.TIMES, "*", 0, 6),
                new Token(TokenType.NUMBER, "2", 0, 7)
        ), tokens);
    }

    @Test
    @DisplayName("Identifiers take letters, digits and underscores")
    void identifiersTakeAlphanumericRun() {
        List<Token> tokens = lexer.tokenize("total_2 = x1");

        assertEquals(List.of(
                new Token(TokenType.IDENTIFIER, "total_2", 0, 0),
                new Token(TokenType.ASSIGN, "=", 0, 8),
                new Token(TokenType.IDENTIFIER, "x1", 0, 10)
        ), tokens);
    }

    @ParameterizedTest
    @DisplayName("Operators and parentheses map to their token type")
    @CsvSource({
            "+, PLUS",
            "-, MINUS",
            "*, TIMES",
            "/, DIV",
            ">, GREATER_THAN",
            ">=, GREATER_THAN_OR_EQUAL",
            "<, LESS_THAN",
            "<=, LESS_THAN_OR_EQUAL",
            "==, EQUAL",
            "=, ASSIGN",
            "(, LEFT_PAREN",
            "), RIGHT_PAREN"
    })
    void operatorsMapToTokenTypes(String symbol, TokenType expected) {
        List<Token> tokens = lexer.tokenize(symbol);

        assertEquals(1, tokens.size());
        assertEquals(expected, tokens.get(0).type());
        assertEquals(symbol, tokens.get(0).text());
    }

    @Test
    @DisplayName("Two-character operators advance the column by two")
    void twoCharacterOperatorsAdvanceByTwo() {
        List<Token> tokens = lexer.tokenize("a>=b==c");

        assertEquals(List.of(
                new Token(TokenType.IDENTIFIER, "a", 0, 0),
                new Token(TokenType.GREATER_THAN_OR_EQUAL, ">=", 0, 1),
                new Token(TokenType.IDENTIFIER, "b", 0, 3),
                new Token(TokenType.EQUAL, "==", 0, 4),
                new Token(TokenType.IDENTIFIER, "c", 0, 6)
        ), tokens);
    }

    @Test
    @DisplayName("Assignment followed by comparison is two tokens")
    void assignThenLess() {
        List<Token> tokens = lexer.tokenize("=<");

        assertEquals(TokenType.ASSIGN, tokens.get(0).type());
        assertEquals(TokenType.LESS_THAN, tokens.get(1).type());
        assertEquals(1, tokens.get(1).column());
    }

    @Test
    @DisplayName("Newline advances the line and resets the column")
    void newlineTracksLines() {
        List<Token> tokens = lexer.tokenize("x = 1\n  y\n\n(2)");

        assertEquals(new Location(0, 4), tokens.get(2).location());
        assertEquals(new Token(TokenType.IDENTIFIER, "y", 1, 2), tokens.get(3));
        assertEquals(new Token(TokenType.LEFT_PAREN, "(", 3, 0), tokens.get(4));
        assertEquals(new Token(TokenType.NUMBER, "2", 3, 1), tokens.get(5));
        assertEquals(new Token(TokenType.RIGHT_PAREN, ")", 3, 2), tokens.get(6));
    }

    @ParameterizedTest
    @DisplayName("Valid number literal lexes to exactly one token")
    @ValueSource(strings = {"0", "5", "42", "2.37", "83e2", "91.5e4", "2.83e+3", "1E-10", "10.125E+12"})
    void validNumberIsSingleToken(String literal) {
        List<Token> tokens = lexer.tokenize(literal);

        assertEquals(List.of(new Token(TokenType.NUMBER, literal, 0, 0)), tokens);
    }

    @Test
    @DisplayName("End location points at the last character of the lexeme")
    void endLocationIsLastCharacter() {
        Token token = lexer.tokenize("  hello").get(0);

        assertEquals(new Location(0, 2), token.location());
        assertEquals(new Location(0, 6), token.endLocation());
    }

    // =====================================================================
    // Errors
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Unsupported character fails at its exact column")
    @CsvSource(delimiter = '|', value = {
            "$|0",
            "1 + $|4",
            "_x|0",
            "a ! b|2",
            "x = 3;|5",
            "{|0"
    })
    void unsupportedCharacterFails(String source, int column) {
        LexerException e = assertThrows(LexerException.class, () -> lexer.tokenize(source));

        assertEquals(ErrorKind.UNRECOGNIZED_CHARACTER, e.getKind());
        assertEquals(Optional.of(new Location(0, column)), e.getLocation());
        assertEquals(String.valueOf(source.charAt(column)), e.getDetail());
    }

    @Test
    @DisplayName("Unsupported character on a later line reports that line")
    void unsupportedCharacterOnLaterLine() {
        LexerException e = assertThrows(LexerException.class, () -> lexer.tokenize("1\n  #"));

        assertEquals(Optional.of(new Location(1, 2)), e.getLocation());
        assertEquals("UnrecognizedCharacter '#' at (1, 2)", e.getMessage());
    }

    @ParameterizedTest
    @DisplayName("Malformed number fails at the first digit")
    @CsvSource(delimiter = '|', value = {
            "2.|0",
            "83e|0",
            "x = 91.e4|4",
            "1 + 7e+|4",
            "(2.)|1"
    })
    void malformedNumberFails(String source, int column) {
        LexerException e = assertThrows(LexerException.class, () -> lexer.tokenize(source));

        assertEquals(ErrorKind.INVALID_NUMBER, e.getKind());
        assertEquals(Optional.of(new Location(0, column)), e.getLocation());
    }
}
