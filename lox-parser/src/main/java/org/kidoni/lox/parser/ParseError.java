package org.kidoni.lox.parser;

import java.util.Objects;

/**
 * One diagnostic reported for a malformed statement.
 *
 * @param token      the offending token; an {@code EOF} token when the input ended early
 * @param production the grammar rule that could not continue
 * @param message    what was expected, e.g. {@code Expect ';' after value.}
 */
public record ParseError(ParseErrorKind kind, Token token, Production production, String message) {
    public ParseError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(production, "production");
        Objects.requireNonNull(message, "message");
    }

    public int line() {
        return token.line();
    }

    public int column() {
        return token.column();
    }

    @Override
    public String toString() {
        String where = token.is(TokenType.EOF) ? "end" : "'" + token.lexeme() + "'";
        return "[line " + line() + ":" + column() + "] Error at " + where + " in " + production + ": " + message;
    }
}
