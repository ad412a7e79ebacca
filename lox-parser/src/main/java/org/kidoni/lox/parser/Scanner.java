package org.kidoni.lox.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.kidoni.lox.ast.Value;

import static java.lang.Character.isWhitespace;
import static org.kidoni.lox.parser.TokenType.*;

/**
 * Turns Lox source text into tokens.
 * <p>
 * Lexemes:
 * <pre>
 *  IDENTIFIER: '[A-Za-z_][A-Za-z0-9_]*'
 *  NUMBER: '[0-9]+' ( '.' '[0-9]+' )?
 *  STRING: '"' '[^"]*' '"'
 *  COMMENT: '//' to end of line, discarded
 * </pre>
 * Characters that start no token, and strings that never close, become {@link TokenType#ERROR}
 * tokens so the parser can report them where they occur. Scanning always runs to the end of the
 * input and the result always ends with {@link TokenType#EOF}.
 */
public class Scanner {
    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "var", VAR,
            "print", PRINT,
            "true", TRUE,
            "false", FALSE,
            "nil", NIL,
            "and", AND,
            "or", OR);

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine;
    private int startColumn;

    public Scanner(final String source) {
        assert source != null;
        this.source = source;
    }

    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }

        tokens.add(Token.of(EOF, "", line, column));
        return List.copyOf(tokens);
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(' -> addToken(LEFT_PAREN);
            case ')' -> addToken(RIGHT_PAREN);
            case ';' -> addToken(SEMICOLON);
            case '+' -> addToken(PLUS);
            case '-' -> addToken(MINUS);
            case '*' -> addToken(STAR);
            case '!' -> addToken(match('=') ? BANG_EQUAL : BANG);
            case '=' -> addToken(match('=') ? EQUAL_EQUAL : EQUAL);
            case '>' -> addToken(match('=') ? GREATER_EQUAL : GREATER);
            case '<' -> addToken(match('=') ? LESS_EQUAL : LESS);
            case '/' -> {
                if (match('/')) {
                    skipComment();
                }
                else {
                    addToken(SLASH);
                }
            }
            case '"' -> string();
            default -> {
                if (isDigit(c)) {
                    number();
                }
                else if (isIdentifierStart(c)) {
                    identifier();
                }
                else if (!isWhitespace(c)) {
                    tokens.add(Token.error(lexeme(), "Unexpected character '" + c + "'.", startLine, startColumn));
                }
            }
        }
    }

    private void skipComment() {
        while (!isAtEnd() && peek() != '\n') {
            advance();
        }
    }

    private void string() {
        while (!isAtEnd() && peek() != '"') {
            advance();
        }

        if (isAtEnd()) {
            tokens.add(Token.error(lexeme(), "Unterminated string.", startLine, startColumn));
            return;
        }

        // closing quote
        advance();

        String value = source.substring(start + 1, current - 1);
        tokens.add(Token.literal(STRING, lexeme(), new Value.Str(value), startLine, startColumn));
    }

    private void number() {
        while (isDigit(peek())) {
            advance();
        }

        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) {
                advance();
            }
        }

        String text = lexeme();
        tokens.add(Token.literal(NUMBER, text, new Value.Number(Double.parseDouble(text)), startLine, startColumn));
    }

    private void identifier() {
        while (isIdentifierPart(peek())) {
            advance();
        }

        String text = lexeme();
        addToken(KEYWORDS.getOrDefault(text, IDENTIFIER));
    }

    private void addToken(final TokenType type) {
        tokens.add(Token.of(type, lexeme(), startLine, startColumn));
    }

    private String lexeme() {
        return source.substring(start, current);
    }

    private boolean match(final char expected) {
        if (isAtEnd() || source.charAt(current) != expected) {
            return false;
        }
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        }
        else {
            column++;
        }
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    // ASCII only; Character.isDigit would admit digits Double.parseDouble rejects
    private static boolean isDigit(final char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(final char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(final char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
