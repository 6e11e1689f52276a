package com.barlang.core.dsl;

/**
 * Token types for the rule lexer
 */
public enum TokenType {
    // Sections
    SECTION,        // ENTRY, EXIT
    COLON,          // :

    // Operators
    LOGICAL,        // AND, OR
    OPERATOR,       // >, <, >=, <=, ==
    CROSS_OP,       // crosses above, crosses below

    // Operands
    FIELD,          // open, high, low, close, volume (+ _yesterday, _last_week)
    FUNCTION,       // SMA, RSI
    IDENTIFIER,     // any other word, rejected by the parser
    NUMBER,         // 14, 1.5, 2K, 1M

    // Punctuation
    LPAREN,         // (
    RPAREN,         // )
    COMMA,          // ,

    // Arithmetic
    PLUS,           // +
    MINUS,          // -
    MULTIPLY,       // *
    DIVIDE,         // /

    // End of input
    EOF
}
