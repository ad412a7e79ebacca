package org.kidoni.lox.parser;

import org.kidoni.lox.ast.BinaryOp;
import org.kidoni.lox.ast.UnaryOp;

public enum TokenType {
    // punctuation
    LEFT_PAREN,
    RIGHT_PAREN,
    SEMICOLON,

    // operators
    PLUS(BinaryOp.ADD, null),
    MINUS(BinaryOp.SUBTRACT, UnaryOp.NEGATE),
    STAR(BinaryOp.MULTIPLY, null),
    SLASH(BinaryOp.DIVIDE, null),
    BANG(null, UnaryOp.NOT),
    BANG_EQUAL(BinaryOp.NOT_EQUAL, null),
    EQUAL,
    EQUAL_EQUAL(BinaryOp.EQUAL, null),
    GREATER(BinaryOp.GREATER, null),
    GREATER_EQUAL(BinaryOp.GREATER_EQUAL, null),
    LESS(BinaryOp.LESS, null),
    LESS_EQUAL(BinaryOp.LESS_EQUAL, null),

    // literals
    IDENTIFIER,
    STRING,
    NUMBER,

    // keywords
    AND(BinaryOp.AND, null),
    OR(BinaryOp.OR, null),
    VAR,
    PRINT,
    TRUE,
    FALSE,
    NIL,

    ERROR,
    EOF;

    private final BinaryOp binaryOp;
    private final UnaryOp unaryOp;

    TokenType() {
        this(null, null);
    }

    TokenType(final BinaryOp binaryOp, final UnaryOp unaryOp) {
        this.binaryOp = binaryOp;
        this.unaryOp = unaryOp;
    }

    public BinaryOp binaryOp() {
        if (binaryOp == null) {
            throw new IllegalStateException(this + " is not a binary operator");
        }
        return binaryOp;
    }

    public UnaryOp unaryOp() {
        if (unaryOp == null) {
            throw new IllegalStateException(this + " is not a unary operator");
        }
        return unaryOp;
    }
}
