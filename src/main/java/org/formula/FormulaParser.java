package org.formula;

import org.error.FormulaSyntaxException;

/**
 * Recursive descent parser for modal formulas.
 *
 * Grammar, lowest precedence first:
 * <pre>
 * iff     := implies ("&lt;-&gt;" implies)*
 * implies := or ("-&gt;" or)*
 * or      := and ("|" and)*
 * and     := unary ("&amp;" unary)*
 * unary   := "~" unary | "[]" unary | "&lt;&gt;" unary | "(" iff ")" | ATOM
 * </pre>
 * Binary operators associate to the left. The whole input has to be consumed.
 */
public final class FormulaParser {

    private final Lexer lexer;
    private Token current;

    public FormulaParser(String text) {
        this.lexer = new Lexer(text);
        this.current = lexer.nextToken();
    }

    /**
     * @throws FormulaSyntaxException on a lexical error, an unexpected token or trailing input
     */
    public Formula parse() {
        Formula result = iff();
        if (!current.is(TokenType.EOF)) {
            throw new FormulaSyntaxException(
                    "Unexpected '" + current.text() + "' at end of formula", current.position());
        }
        return result;
    }

    private Formula iff() {
        Formula node = implies();
        while (current.is(TokenType.IFF)) {
            eat(TokenType.IFF);
            node = new Formula.Iff(node, implies());
        }
        return node;
    }

    private Formula implies() {
        Formula node = or();
        while (current.is(TokenType.IMPLIES)) {
            eat(TokenType.IMPLIES);
            node = new Formula.Implies(node, or());
        }
        return node;
    }

    private Formula or() {
        Formula node = and();
        while (current.is(TokenType.OR)) {
            eat(TokenType.OR);
            node = new Formula.Or(node, and());
        }
        return node;
    }

    private Formula and() {
        Formula node = unary();
        while (current.is(TokenType.AND)) {
            eat(TokenType.AND);
            node = new Formula.And(node, unary());
        }
        return node;
    }

    private Formula unary() {
        switch (current.type()) {
            case NOT:
                eat(TokenType.NOT);
                return new Formula.Not(unary());
            case BOX:
                eat(TokenType.BOX);
                return new Formula.Box(unary());
            case DIAMOND:
                eat(TokenType.DIAMOND);
                return new Formula.Diamond(unary());
            case LPAREN:
                eat(TokenType.LPAREN);
                Formula inner = iff();
                eat(TokenType.RPAREN);
                return inner;
            case ATOM:
                String name = current.text();
                eat(TokenType.ATOM);
                return new Formula.Atom(name);
            default:
                throw new FormulaSyntaxException("Unexpected " + describe(current) + " in formula", current.position());
        }
    }

    private void eat(TokenType expected) {
        if (!current.is(expected)) {
            throw new FormulaSyntaxException(
                    "Expected " + expected + ", got " + describe(current), current.position());
        }
        current = lexer.nextToken();
    }

    private static String describe(Token token) {
        return token.is(TokenType.EOF) ? "end of formula" : token.type() + " '" + token.text() + "'";
    }
}
