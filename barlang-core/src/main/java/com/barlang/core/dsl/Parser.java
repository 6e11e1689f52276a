package com.barlang.core.dsl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for the rule language.
 *
 * Grammar (lowest to highest precedence):
 * strategy       = ( "ENTRY" ":" logical_or )? ( "EXIT" ":" logical_or )? EOF
 * logical_or     = logical_and ( "OR" logical_and )*
 * logical_and    = comparison ( "AND" comparison )*
 * comparison     = arithmetic ( OPERATOR arithmetic | CROSS_OP arithmetic )?
 * arithmetic     = term ( (PLUS | MINUS) term )*
 * term           = primary ( (MULTIPLY | DIVIDE) primary )*
 * primary        = number | "-" number | field | function_call | "(" logical_or ")"
 * function_call  = FUNCTION "(" field "," integer ")"
 */
public class Parser {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private List<Token> tokens = new ArrayList<>();
    private int position = 0;

    /**
     * Parse rule text into a Strategy.
     *
     * @throws ParserException on any grammar violation
     * @throws Lexer.LexerException on unrecognized input
     */
    public AstNode.Strategy parse(String source) {
        this.tokens = Lexer.tokenize(source);
        this.position = 0;
        AstNode.Strategy strategy = strategy();
        log.debug("Parsed {} tokens (entry: {}, exit: {})", tokens.size(), strategy.hasEntry(), strategy.hasExit());
        return strategy;
    }

    /**
     * Parse rule text, reporting failures in the result instead of throwing.
     */
    public ParseResult tryParse(String source) {
        try {
            return new ParseResult(true, parse(source), null, null);
        } catch (ParserException e) {
            return new ParseResult(false, null, e.getMessage(), e.getPosition());
        } catch (Lexer.LexerException e) {
            return new ParseResult(false, null, e.getMessage(), e.getPosition());
        }
    }

    // ========== Parser Methods ==========

    private AstNode.Strategy strategy() {
        AstNode entry = null;
        AstNode exit = null;

        if (checkSection("ENTRY")) {
            advance();
            expect(TokenType.COLON, "':' after ENTRY");
            entry = section();
        }

        if (checkSection("EXIT")) {
            advance();
            expect(TokenType.COLON, "':' after EXIT");
            exit = section();
        }

        if (!check(TokenType.EOF)) {
            if (checkSection("ENTRY") || checkSection("EXIT")) {
                throw new ParserException("Section " + current().value() + " is out of order or repeated " +
                    "(ENTRY must come before EXIT, each at most once)", current().position());
            }
            throw unexpected(entry == null && exit == null
                ? "'ENTRY:', 'EXIT:' or end of input"
                : "'AND', 'OR', 'EXIT:' or end of input");
        }

        return new AstNode.Strategy(entry, exit);
    }

    private AstNode section() {
        Token start = current();
        AstNode condition = logicalOr();
        requireCondition(condition, start);
        return condition;
    }

    private AstNode logicalOr() {
        Token start = current();
        AstNode left = logicalAnd();

        while (checkLogical("OR")) {
            requireCondition(left, start);
            advance();
            Token rightStart = current();
            AstNode right = logicalAnd();
            requireCondition(right, rightStart);
            left = new AstNode.Logical("OR", left, right);
        }

        return left;
    }

    private AstNode logicalAnd() {
        Token start = current();
        AstNode left = comparison();

        while (checkLogical("AND")) {
            requireCondition(left, start);
            advance();
            Token rightStart = current();
            AstNode right = comparison();
            requireCondition(right, rightStart);
            left = new AstNode.Logical("AND", left, right);
        }

        return left;
    }

    private AstNode comparison() {
        Token start = current();
        AstNode left = arithmetic();

        // Check for comparison operator
        if (check(TokenType.OPERATOR)) {
            requireValue(left, start);
            String operator = advance().value();
            Token rightStart = current();
            AstNode right = arithmetic();
            requireValue(right, rightStart);
            return new AstNode.Comparison(left, operator, right);
        }

        // Check for cross phrase
        if (check(TokenType.CROSS_OP)) {
            requireValue(left, start);
            AstNode.CrossDirection direction = AstNode.CrossDirection.valueOf(advance().value());
            Token rightStart = current();
            AstNode right = arithmetic();
            requireValue(right, rightStart);
            return new AstNode.Cross(left, direction, right);
        }

        return left;
    }

    private AstNode arithmetic() {
        Token start = current();
        AstNode left = term();

        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            requireValue(left, start);
            String operator = advance().value();
            Token rightStart = current();
            AstNode right = term();
            requireValue(right, rightStart);
            left = new AstNode.Binary(left, operator, right);
        }

        return left;
    }

    private AstNode term() {
        Token start = current();
        AstNode left = primary();

        while (check(TokenType.MULTIPLY) || check(TokenType.DIVIDE)) {
            requireValue(left, start);
            String operator = advance().value();
            Token rightStart = current();
            AstNode right = primary();
            requireValue(right, rightStart);
            left = new AstNode.Binary(left, operator, right);
        }

        return left;
    }

    private AstNode primary() {
        // Parenthesized expression
        if (check(TokenType.LPAREN)) {
            advance();
            AstNode expr = logicalOr();
            expect(TokenType.RPAREN, "')' after expression");
            return expr;
        }

        // Negative number literal
        if (check(TokenType.MINUS) && peek(1).type() == TokenType.NUMBER) {
            advance();
            return new AstNode.Number(-numberValue(advance()));
        }

        // Number literal
        if (check(TokenType.NUMBER)) {
            return new AstNode.Number(numberValue(advance()));
        }

        // Field reference
        if (check(TokenType.FIELD)) {
            return new AstNode.Identifier(advance().value());
        }

        // Indicator call
        if (check(TokenType.FUNCTION)) {
            return functionCall();
        }

        if (check(TokenType.IDENTIFIER)) {
            Token token = current();
            if (peek(1).type() == TokenType.LPAREN) {
                throw new ParserException("Unknown function '" + token.value() +
                    "' at position " + token.position() + " (expected SMA or RSI)", token.position());
            }
            throw new ParserException("Unknown field '" + token.value() +
                "' at position " + token.position() + " (expected one of open, high, low, close, volume)",
                token.position());
        }

        throw unexpected("a number, field, function call or '('");
    }

    private AstNode.FunctionCall functionCall() {
        Token nameToken = advance();
        String name = nameToken.value();

        expect(TokenType.LPAREN, "'(' after " + name);
        List<AstNode> arguments = new ArrayList<>();
        List<Token> argumentStarts = new ArrayList<>();

        if (!check(TokenType.RPAREN)) {
            argumentStarts.add(current());
            arguments.add(arithmetic());
            while (check(TokenType.COMMA)) {
                advance();
                argumentStarts.add(current());
                arguments.add(arithmetic());
            }
        }
        expect(TokenType.RPAREN, "')' after " + name + " arguments");

        validateArguments(name, nameToken, arguments, argumentStarts);
        return new AstNode.FunctionCall(name, arguments);
    }

    private void validateArguments(String name, Token nameToken, List<AstNode> arguments, List<Token> starts) {
        if (arguments.size() != 2) {
            throw new ParserException(name + " requires 2 arguments (field, window), got " +
                arguments.size() + " at position " + nameToken.position(), nameToken.position());
        }

        if (!(arguments.get(0) instanceof AstNode.Identifier)) {
            Token start = starts.get(0);
            throw new ParserException("Expected a field as first argument of " + name + ", got " +
                start.describe() + " at position " + start.position(), start.position());
        }

        Token windowStart = starts.get(1);
        if (!(arguments.get(1) instanceof AstNode.Number window)) {
            throw new ParserException("Expected an integer window as second argument of " + name + ", got " +
                windowStart.describe() + " at position " + windowStart.position(), windowStart.position());
        }
        double value = window.value();
        if (value != Math.rint(value) || value < 1) {
            throw new ParserException(name + " window must be a positive integer, got " + value +
                " at position " + windowStart.position(), windowStart.position());
        }
    }

    /**
     * Convert a NUMBER token to its value, applying K (thousand) and M (million) suffixes.
     */
    private double numberValue(Token token) {
        String text = token.value();
        double multiplier = 1;
        if (text.endsWith("K")) {
            multiplier = 1_000;
            text = text.substring(0, text.length() - 1);
        } else if (text.endsWith("M")) {
            multiplier = 1_000_000;
            text = text.substring(0, text.length() - 1);
        }
        try {
            return Double.parseDouble(text) * multiplier;
        } catch (NumberFormatException e) {
            throw new ParserException("Invalid number '" + token.value() + "' at position " + token.position(),
                token.position());
        }
    }

    private void requireCondition(AstNode node, Token start) {
        if (!AstNode.isCondition(node)) {
            throw new ParserException("Expected a comparison or cross condition at position " +
                start.position() + ", got a value starting with " + start.describe(), start.position());
        }
    }

    private void requireValue(AstNode node, Token start) {
        if (!AstNode.isValue(node)) {
            throw new ParserException("Expected a value at position " + start.position() +
                ", got a condition starting with " + start.describe(), start.position());
        }
    }

    // ========== Helper Methods ==========

    private Token current() {
        return peek(0);
    }

    private Token peek(int offset) {
        int index = position + offset;
        if (index >= tokens.size()) {
            return tokens.isEmpty() ? Token.eof(0) : tokens.get(tokens.size() - 1);
        }
        return tokens.get(index);
    }

    private boolean check(TokenType type) {
        return current().type() == type;
    }

    private boolean checkSection(String name) {
        return check(TokenType.SECTION) && name.equals(current().value());
    }

    private boolean checkLogical(String operator) {
        return check(TokenType.LOGICAL) && operator.equals(current().value());
    }

    private Token advance() {
        Token token = current();
        if (token.type() != TokenType.EOF) {
            position++;
        }
        return token;
    }

    private void expect(TokenType type, String expected) {
        if (!check(type)) {
            throw unexpected(expected);
        }
        advance();
    }

    private ParserException unexpected(String expected) {
        Token found = current();
        return new ParserException("Expected " + expected + ", got " + found.describe() +
            " at position " + found.position(), found.position());
    }

    // ========== Result Types ==========

    /**
     * Result of parsing
     */
    public record ParseResult(boolean success, AstNode.Strategy strategy, String error, Integer errorPosition) {}

    /**
     * Exception thrown during parsing
     */
    public static class ParserException extends RuntimeException {

        private final int position;

        public ParserException(String message, int position) {
            super(message);
            this.position = position;
        }

        public int getPosition() {
            return position;
        }
    }
}
