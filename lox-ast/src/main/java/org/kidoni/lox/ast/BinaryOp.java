package org.kidoni.lox.ast;

import java.util.Optional;

public enum BinaryOp {
    // arithmetic
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),

    // comparison
    GREATER(">"),
    GREATER_EQUAL(">="),
    LESS("<"),
    LESS_EQUAL("<="),
    EQUAL("=="),
    NOT_EQUAL("!="),

    // logical
    AND("and"),
    OR("or");

    private final String lexeme;

    BinaryOp(final String lexeme) {
        this.lexeme = lexeme;
    }

    public String lexeme() {
        return lexeme;
    }

    public static Optional<BinaryOp> fromLexeme(final String lexeme) {
        for (BinaryOp op : values()) {
            if (op.lexeme.equals(lexeme)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return lexeme;
    }
}
