package org.formula;

import org.error.FormulaSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits formula text into tokens, one at a time.
 *
 * Multi-character operators are recognised greedily with one character of lookahead:
 * "[" must be followed by "]", "-" by ">", and "<" by either ">" (diamond) or "->" (iff).
 */
public final class Lexer {

    private final String text;
    private int pos;

    public Lexer(String text) {
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.pos = 0;
    }

    /**
     * @return the next token, or an EOF token once the input is exhausted
     * @throws FormulaSyntaxException on an unknown character or a malformed operator
     */
    public Token nextToken() {
        skipWhitespace();

        if (pos >= text.length()) {
            return new Token(TokenType.EOF, "", pos);
        }

        int start = pos;
        char c = text.charAt(pos);

        if (Character.isLetterOrDigit(text.codePointAt(pos))) {
            return atom();
        }

        switch (c) {
            case '~':
                pos++;
                return new Token(TokenType.NOT, "~", start);
            case '&':
                pos++;
                return new Token(TokenType.AND, "&", start);
            case '|':
                pos++;
                return new Token(TokenType.OR, "|", start);
            case '(':
                pos++;
                return new Token(TokenType.LPAREN, "(", start);
            case ')':
                pos++;
                return new Token(TokenType.RPAREN, ")", start);
            case '[':
                pos++;
                expect(']', "Expected ']' after '['");
                return new Token(TokenType.BOX, "[]", start);
            case '-':
                pos++;
                expect('>', "Expected '>' after '-'");
                return new Token(TokenType.IMPLIES, "->", start);
            case '<':
                pos++;
                if (peek() == '>') {
                    pos++;
                    return new Token(TokenType.DIAMOND, "<>", start);
                }
                if (peek() == '-') {
                    pos++;
                    expect('>', "Expected '>' after '<-'");
                    return new Token(TokenType.IFF, "<->", start);
                }
                throw new FormulaSyntaxException("Expected '>' or '-' after '<'", pos);
            default:
                String unknown = new String(Character.toChars(text.codePointAt(start)));
                throw new FormulaSyntaxException("Unknown character: '" + unknown + "'", start);
        }
    }

    /**
     * Tokenizes the remaining input, including the trailing EOF token.
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token t;
        do {
            t = nextToken();
            tokens.add(t);
        } while (!t.is(TokenType.EOF));
        return tokens;
    }

    private Token atom() {
        int start = pos;
        // code points, so letters outside the BMP stay in one atom
        while (pos < text.length()) {
            int cp = text.codePointAt(pos);
            if (!Character.isLetterOrDigit(cp)) {
                break;
            }
            pos += Character.charCount(cp);
        }
        return new Token(TokenType.ATOM, text.substring(start, pos), start);
    }

    private void expect(char expected, String message) {
        if (peek() != expected) {
            throw new FormulaSyntaxException(message, pos);
        }
        pos++;
    }

    // 0 marks end of input
    private char peek() {
        return pos < text.length() ? text.charAt(pos) : 0;
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }
}
