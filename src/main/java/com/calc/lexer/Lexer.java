package com.calc.lexer;

import com.calc.exception.LexerException;
import com.calc.fsm.NumberRecognizer;

import java.nio.CharBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.calc.lexer.LexerConfig.*;

/**
 * Converts source text into a sequence of tokens.
 * <p>
 * Positions are zero based. A newline moves to the next line and resets the
 * column; every other consumed character advances the column by one.
 * Number literals are delegated to the {@link NumberRecognizer}.
 */
public final class Lexer {

    private final NumberRecognizer numberRecognizer;

    public Lexer() {
        this(new NumberRecognizer());
    }

    public Lexer(NumberRecognizer numberRecognizer) {
        this.numberRecognizer = numberRecognizer;
    }

    /**
     * Tokenize the source text.
     *
     * @param source Source text
     * @return Tokens in source order, without an end-of-input marker
     * @throws LexerException on the first character that cannot start a token
     */
    public List<Token> tokenize(String source) {
        return new Scan(source).run();
    }

    /**
     * Cursor over one input. Offset, line and column only move together.
     */
    private final class Scan {
        private final String input;
        private final int length;
        private int pos;
        private int line;
        private int column;

        Scan(String input) {
            this.input = input;
            this.length = input.length();
        }

        List<Token> run() {
            List<Token> tokens = new ArrayList<>();

            while (!isAtEnd()) {
                char c = peek();

                if (Character.isWhitespace(c)) {
                    advance();
                    continue;
                }

                TokenType single = SINGLE_CHAR_TOKENS.get(c);
                if (single != null) {
                    tokens.add(emit(single, 1));
                } else if (c == Operators.EQUALS) {
                    tokens.add(withOptionalEquals(TokenType.ASSIGN, TokenType.EQUAL));
                } else if (c == Operators.GREATER) {
                    tokens.add(withOptionalEquals(TokenType.GREATER_THAN, TokenType.GREATER_THAN_OR_EQUAL));
                } else if (c == Operators.LESS) {
                    tokens.add(withOptionalEquals(TokenType.LESS_THAN, TokenType.LESS_THAN_OR_EQUAL));
                } else if (isIdentifierStart(c)) {
                    tokens.add(readIdentifier());
                } else if (isDigit(c)) {
                    tokens.add(readNumber());
                } else {
                    throw LexerException.unrecognizedCharacter(c, line, column);
                }
            }

            return tokens;
        }

        private Token withOptionalEquals(TokenType single, TokenType withEquals) {
            if (pos + 1 < length && input.charAt(pos + 1) == Operators.EQUALS) {
                return emit(withEquals, 2);
            }
            return emit(single, 1);
        }

        private Token readIdentifier() {
            int end = pos;
            while (end < length && isIdentifierPart(input.charAt(end))) {
                end++;
            }
            return emit(TokenType.IDENTIFIER, end - pos);
        }

        private Token readNumber() {
            Optional<String> literal = numberRecognizer.recognize(CharBuffer.wrap(input, pos, length));
            if (literal.isEmpty()) {
                throw LexerException.invalidNumber(line, column);
            }
            return emit(TokenType.NUMBER, literal.get().length());
        }

        private Token emit(TokenType type, int size) {
            Token token = new Token(type, input.substring(pos, pos + size), line, column);
            for (int i = 0; i < size; i++) {
                advance();
            }
            return token;
        }

        private void advance() {
            char c = input.charAt(pos++);
            if (c == Operators.NEWLINE) {
                line++;
                column = 0;
            } else {
                column++;
            }
        }

        private char peek() {
            return input.charAt(pos);
        }

        private boolean isAtEnd() {
            return pos >= length;
        }
    }
}
