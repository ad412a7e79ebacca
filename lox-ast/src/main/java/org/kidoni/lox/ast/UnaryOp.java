package org.kidoni.lox.ast;

import java.util.Optional;

public enum UnaryOp {
    NEGATE("-"),
    NOT("!");

    private final String lexeme;

    UnaryOp(final String lexeme) {
        this.lexeme = lexeme;
    }

    public String lexeme() {
        return lexeme;
    }

    public static Optional<UnaryOp> fromLexeme(final String lexeme) {
        for (UnaryOp op : values()) {
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
