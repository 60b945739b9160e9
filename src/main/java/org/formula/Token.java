package org.formula;

import java.util.Objects;

/**
 * One lexical token and the offset of its first character in the formula text.
 */
public record Token(TokenType type, String text, int position) {

    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (position < 0) {
            throw new IllegalArgumentException("position must be >= 0");
        }
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }
}
