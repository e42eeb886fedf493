package com.calc.parser;

import com.calc.ast.AssignmentNode;
import com.calc.ast.BinaryNode;
import com.calc.ast.BinaryOperator;
import com.calc.ast.IdentifierNode;
import com.calc.ast.NumberNode;
import com.calc.ast.ParseNode;
import com.calc.ast.RootNode;
import com.calc.config.StatementMode;
import com.calc.core.Location;
import com.calc.exception.SyntaxException;
import com.calc.lexer.Token;
import com.calc.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser producing a {@link RootNode}.
 * <p>
 * Grammar (precedence: comparison &lt; additive &lt; multiplicative):
 * <pre>
 * expr      := IDENTIFIER '=' rightExpr | rightExpr
 * rightExpr := compTerm (('&gt;' | '&gt;=' | '&lt;' | '&lt;=' | '==') compTerm)?
 * compTerm  := term (('+' | '-') term)?
 * term      := factor (('*' | '/') factor)?
 * factor    := NUMBER | IDENTIFIER | '(' rightExpr ')'
 * </pre>
 * Every binary level takes at most one operator. A second operator on the
 * same level is left over and reported as an unexpected token.
 */
public final class Parser {

    private static final TokenType[] COMPARISON_OPERATORS = {
            TokenType.GREATER_THAN,
            TokenType.GREATER_THAN_OR_EQUAL,
            TokenType.LESS_THAN,
            TokenType.LESS_THAN_OR_EQUAL,
            TokenType.EQUAL
    };

    private final StatementMode statementMode;

    public Parser() {
        this(StatementMode.SINGLE_EXPRESSION);
    }

    public Parser(StatementMode statementMode) {
        this.statementMode = statementMode;
    }

    /**
     * Parse the token stream into a syntax tree.
     *
     * @param tokens Tokens produced by the lexer
     * @return Root node; empty if there are no tokens
     * @throws SyntaxException if the tokens do not form a valid program
     */
    public RootNode parse(List<Token> tokens) {
        if (tokens.isEmpty()) {
            return RootNode.empty();
        }
        return new Descent(tokens).parse();
    }

    public StatementMode getStatementMode() {
        return statementMode;
    }

    private final class Descent {
        private final List<Token> tokens;
        private int index;

        Descent(List<Token> tokens) {
            this.tokens = tokens;
        }

        RootNode parse() {
            List<ParseNode> statements = new ArrayList<>();
            statements.add(parseExpression());

            while (!isAtEnd()) {
                if (statementMode == StatementMode.LINE_SEPARATED && startsNewLine()) {
                    statements.add(parseExpression());
                } else {
                    throw unexpectedToken(peek());
                }
            }

            return new RootNode(statements, tokens.get(0).location());
        }

        private ParseNode parseExpression() {
            if (check(TokenType.IDENTIFIER) && checkNext(TokenType.ASSIGN)) {
                Token name = advance();
                Token assign = advance();
                ParseNode value = parseRightExpression();
                return new AssignmentNode(name.text(), value, assign.location());
            }
            return parseRightExpression();
        }

        private ParseNode parseRightExpression() {
            ParseNode left = parseCompTerm();
            if (match(COMPARISON_OPERATORS)) {
                Token operator = previous();
                return binary(operator, left, parseCompTerm());
            }
            return left;
        }

        private ParseNode parseCompTerm() {
            ParseNode left = parseTerm();
            if (match(TokenType.PLUS, TokenType.MINUS)) {
                Token operator = previous();
                return binary(operator, left, parseTerm());
            }
            return left;
        }

        private ParseNode parseTerm() {
            ParseNode left = parseFactor();
            if (match(TokenType.TIMES, TokenType.DIV)) {
                Token operator = previous();
                return binary(operator, left, parseFactor());
            }
            return left;
        }

        private ParseNode parseFactor() {
            if (isAtEnd()) {
                throw SyntaxException.unexpectedEndOfLine(endOfInputLocation());
            }

            Token token = advance();
            return switch (token.type()) {
                case NUMBER -> new NumberNode(Double.parseDouble(token.text()), token.location());
                case IDENTIFIER -> new IdentifierNode(token.text(), token.location());
                case LEFT_PAREN -> {
                    ParseNode inner = parseRightExpression();
                    expectCloseParen();
                    yield inner;
                }
                default -> throw unexpectedToken(token);
            };
        }

        private void expectCloseParen() {
            if (isAtEnd()) {
                throw SyntaxException.expectedCloseParen(SyntaxException.END_OF_LINE, endOfInputLocation());
            }
            if (!check(TokenType.RIGHT_PAREN)) {
                Token found = peek();
                throw SyntaxException.expectedCloseParen(found.text(), found.location());
            }
            advance();
        }

        private ParseNode binary(Token operator, ParseNode left, ParseNode right) {
            BinaryOperator op = BinaryOperator.fromTokenType(operator.type())
                    .orElseThrow(() -> unexpectedToken(operator));
            return new BinaryNode(op, left, right, operator.location());
        }

        private boolean startsNewLine() {
            return peek().line() > previous().endLocation().line();
        }

        private boolean match(TokenType... types) {
            for (TokenType type : types) {
                if (check(type)) {
                    advance();
                    return true;
                }
            }
            return false;
        }

        private boolean check(TokenType type) {
            return !isAtEnd() && peek().type() == type;
        }

        private boolean checkNext(TokenType type) {
            return index + 1 < tokens.size() && tokens.get(index + 1).type() == type;
        }

        private Token advance() {
            return tokens.get(index++);
        }

        private boolean isAtEnd() {
            return index >= tokens.size();
        }

        private Token peek() {
            return tokens.get(index);
        }

        private Token previous() {
            return tokens.get(index - 1);
        }

        private Location endOfInputLocation() {
            return index == 0 ? Location.START : previous().endLocation();
        }

        private SyntaxException unexpectedToken(Token token) {
            return SyntaxException.unexpectedToken(token.text(), token.location());
        }
    }
}
