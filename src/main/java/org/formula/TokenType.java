package org.formula;

/**
 * Token kinds of the formula surface syntax.
 */
public enum TokenType {
    ATOM,
    NOT,       // ~
    BOX,       // []
    DIAMOND,   // <>
    AND,       // &
    OR,        // |
    IMPLIES,   // ->
    IFF,       // <->
    LPAREN,
    RPAREN,
    EOF
}
