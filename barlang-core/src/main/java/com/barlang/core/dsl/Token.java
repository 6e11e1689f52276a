package com.barlang.core.dsl;

/**
 * Token produced by the lexer
 */
public record Token(TokenType type, String value, int position) {

    public static Token eof(int position) {
        return new Token(TokenType.EOF, "", position);
    }

    /**
     * Text used in error messages
     */
    public String describe() {
        return type == TokenType.EOF ? "end of input" : "'" + value + "'";
    }
}
