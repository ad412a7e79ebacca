package org.kidoni.lox.ast;

public class AstJsonException extends RuntimeException {
    public AstJsonException(final String message) {
        super(message);
    }

    public AstJsonException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
