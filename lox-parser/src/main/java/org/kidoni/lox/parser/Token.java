package org.kidoni.lox.parser;

import org.kidoni.lox.ast.Value;

/**
 * A lexeme with its source position. Columns are 1-based and count characters.
 *
 * @param literal the scanned value of a {@code NUMBER} or {@code STRING} token, otherwise {@code null}
 * @param error   what went wrong for an {@code ERROR} token, otherwise {@code null}
 */
public record Token(TokenType type, String lexeme, Value literal, String error, int line, int column) {
    public static Token of(final TokenType type, final String lexeme, final int line, final int column) {
        return new Token(type, lexeme, null, null, line, column);
    }

    public static Token literal(final TokenType type, final String lexeme, final Value literal, final int line, final int column) {
        return new Token(type, lexeme, literal, null, line, column);
    }

    public static Token error(final String lexeme, final String error, final int line, final int column) {
        return new Token(TokenType.ERROR, lexeme, null, error, line, column);
    }

    public boolean is(final TokenType type) {
        return this.type == type;
    }

    @Override
    public String toString() {
        return type + " " + lexeme + (literal != null ? " " + literal : "");
    }
}
