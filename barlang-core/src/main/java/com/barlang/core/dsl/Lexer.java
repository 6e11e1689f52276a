package com.barlang.core.dsl;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Rule lexer - tokenizes ENTRY/EXIT rule text.
 * Words are matched case-insensitively.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        // Sections
        Map.entry("ENTRY", TokenType.SECTION),
        Map.entry("EXIT", TokenType.SECTION),

        // Logical operators
        Map.entry("AND", TokenType.LOGICAL),
        Map.entry("OR", TokenType.LOGICAL),

        // Functions
        Map.entry("SMA", TokenType.FUNCTION),
        Map.entry("RSI", TokenType.FUNCTION)
    );

    private static final Pattern FIELD = Pattern.compile(
        "(open|high|low|close|volume)(_yesterday|_last_week)?");

    private static final String CROSSES = "crosses";

    private final String source;
    private int position = 0;
    private final List<Token> tokens = new ArrayList<>();

    public Lexer(String source) {
        this.source = source != null ? source : "";
    }

    /**
     * Tokenize the source string
     */
    public List<Token> tokenize() {
        tokens.clear();
        position = 0;

        while (position < source.length()) {
            skipWhitespace();

            if (position >= source.length()) {
                break;
            }

            char c = source.charAt(position);

            // Single character tokens
            switch (c) {
                case '(' -> { addToken(TokenType.LPAREN, "("); position++; continue; }
                case ')' -> { addToken(TokenType.RPAREN, ")"); position++; continue; }
                case ',' -> { addToken(TokenType.COMMA, ","); position++; continue; }
                case ':' -> { addToken(TokenType.COLON, ":"); position++; continue; }
                case '*' -> { addToken(TokenType.MULTIPLY, "*"); position++; continue; }
                case '/' -> { addToken(TokenType.DIVIDE, "/"); position++; continue; }
                case '+' -> { addToken(TokenType.PLUS, "+"); position++; continue; }
                case '-' -> { addToken(TokenType.MINUS, "-"); position++; continue; }
                default -> { }
            }

            // Comparison operators
            if (c == '>' || c == '<') {
                if (peek(1) == '=') {
                    addToken(TokenType.OPERATOR, c + "=");
                    position += 2;
                } else {
                    addToken(TokenType.OPERATOR, String.valueOf(c));
                    position++;
                }
                continue;
            }

            if (c == '=') {
                if (peek(1) != '=') {
                    throw new LexerException("=", position);
                }
                addToken(TokenType.OPERATOR, "==");
                position += 2;
                continue;
            }

            // Numbers
            if (Character.isDigit(c)) {
                readNumber();
                continue;
            }

            // Identifiers and keywords
            if (Character.isLetter(c) || c == '_') {
                readWord();
                continue;
            }

            throw new LexerException(String.valueOf(c), position);
        }

        tokens.add(Token.eof(position));
        return tokens;
    }

    private void skipWhitespace() {
        while (position < source.length() && Character.isWhitespace(source.charAt(position))) {
            position++;
        }
    }

    private char peek(int offset) {
        int pos = position + offset;
        if (pos >= source.length()) {
            return '\0';
        }
        return source.charAt(pos);
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private void readNumber() {
        int start = position;

        while (position < source.length() && Character.isDigit(source.charAt(position))) {
            position++;
        }

        if (peek(0) == '.') {
            position++;
            if (!Character.isDigit(peek(0))) {
                throw new LexerException(source.substring(start, position), start);
            }
            while (position < source.length() && Character.isDigit(source.charAt(position))) {
                position++;
            }
        }

        // Optional K/M scale suffix, directly attached
        char next = peek(0);
        if ((next == 'K' || next == 'k' || next == 'M' || next == 'm') && !isWordChar(peek(1))) {
            position++;
        } else if (isWordChar(next)) {
            int end = position;
            while (end < source.length() && isWordChar(source.charAt(end))) {
                end++;
            }
            throw new LexerException(source.substring(start, end), start);
        }

        String value = source.substring(start, position);
        tokens.add(new Token(TokenType.NUMBER, value.toUpperCase(Locale.ROOT), start));
    }

    private String scanWord() {
        int start = position;
        while (position < source.length() && isWordChar(source.charAt(position))) {
            position++;
        }
        return source.substring(start, position);
    }

    private void readWord() {
        int start = position;
        String word = scanWord();
        String upper = word.toUpperCase(Locale.ROOT);
        String lower = word.toLowerCase(Locale.ROOT);

        TokenType keyword = KEYWORDS.get(upper);
        if (keyword != null) {
            tokens.add(new Token(keyword, upper, start));
            return;
        }

        if (FIELD.matcher(lower).matches()) {
            tokens.add(new Token(TokenType.FIELD, lower, start));
            return;
        }

        if (CROSSES.equals(lower)) {
            readCrossPhrase(start);
            return;
        }

        tokens.add(new Token(TokenType.IDENTIFIER, word, start));
    }

    /**
     * "crosses above" / "crosses below", any whitespace between the two words
     */
    private void readCrossPhrase(int start) {
        skipWhitespace();
        String direction = scanWord().toLowerCase(Locale.ROOT);

        switch (direction) {
            case "above" -> tokens.add(new Token(TokenType.CROSS_OP, AstNode.CrossDirection.CROSS_ABOVE.name(), start));
            case "below" -> tokens.add(new Token(TokenType.CROSS_OP, AstNode.CrossDirection.CROSS_BELOW.name(), start));
            default -> throw new LexerException(source.substring(start, position).trim(), start);
        }
    }

    private void addToken(TokenType type, String value) {
        tokens.add(new Token(type, value, position));
    }

    /**
     * Convenience function to tokenize a string
     */
    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    /**
     * Exception thrown when the lexer meets a lexeme it does not recognize
     */
    public static class LexerException extends RuntimeException {

        private final String lexeme;
        private final int position;

        public LexerException(String lexeme, int position) {
            super("Unrecognized input '" + lexeme + "' at position " + position);
            this.lexeme = lexeme;
            this.position = position;
        }

        public String getLexeme() {
            return lexeme;
        }

        public int getPosition() {
            return position;
        }
    }
}
