package org.kidoni.lox.parser;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.kidoni.lox.parser.TokenType.*;

/**
 * Position in a scanned token list, shared by the statement driver and the expression backends
 * for the duration of a single parse.
 */
public final class TokenCursor {
    private static final Set<TokenType> OPERAND_START = EnumSet.of(
            NUMBER, STRING, TRUE, FALSE, NIL, IDENTIFIER, LEFT_PAREN, MINUS, BANG);

    private final List<Token> tokens;
    private int current = 0;

    public TokenCursor(final List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(EOF)) {
            throw new IllegalArgumentException("token list must end with EOF");
        }
        this.tokens = tokens;
    }

    public int position() {
        return current;
    }

    public Token peek() {
        return tokens.get(current);
    }

    public Token previous() {
        return tokens.get(current - 1);
    }

    public boolean isAtEnd() {
        return peek().is(EOF);
    }

    public Token advance() {
        if (!isAtEnd()) {
            current++;
        }
        return previous();
    }

    public boolean check(final TokenType type) {
        return !isAtEnd() && peek().is(type);
    }

    public boolean match(final TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    public Token consume(final TokenType type, final Production production, final String message) {
        if (check(type)) {
            return advance();
        }
        throw error(peek(), production, message);
    }

    /**
     * Builds the exception for a token the grammar cannot accept. The kind follows from the
     * token: scanner errors are lexical, {@code EOF} means the input ended early.
     */
    public ParseException error(final Token token, final Production production, final String message) {
        ParseError error = switch (token.type()) {
            case ERROR -> new ParseError(ParseErrorKind.LEXICAL_ERROR, token, production, token.error());
            case EOF -> new ParseError(ParseErrorKind.UNEXPECTED_END_OF_INPUT, token, production, message);
            default -> new ParseError(ParseErrorKind.UNEXPECTED_TOKEN, token, production, message);
        };
        return new ParseException(error);
    }

    /**
     * Fails unless the next token can begin an operand of {@code operator}, so that a missing
     * operand is reported against the rule owning the operator rather than against {@code primary}.
     */
    public void expectOperand(final Token operator, final Production production) {
        if (!OPERAND_START.contains(peek().type())) {
            throw error(peek(), production, "Expect expression after '" + operator.lexeme() + "'.");
        }
    }

    public ParseException invalidAssignmentTarget(final Token equals) {
        return new ParseException(new ParseError(ParseErrorKind.INVALID_ASSIGNMENT_TARGET, equals,
                Production.ASSIGNMENT, "Invalid assignment target."));
    }

    /**
     * Discards tokens up to the next statement boundary: past a {@code ;}, or up to (not past) a
     * {@code var} or {@code print} keyword, or to the end of input.
     */
    public void synchronize() {
        while (!isAtEnd()) {
            if (peek().is(SEMICOLON)) {
                advance();
                return;
            }
            if (peek().is(VAR) || peek().is(PRINT)) {
                return;
            }
            advance();
        }
    }
}
