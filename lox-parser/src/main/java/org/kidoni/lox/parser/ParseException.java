package org.kidoni.lox.parser;

/**
 * Unwinds from the grammar rule that found a {@link ParseError} to the statement loop, which
 * records the error and resynchronizes. Never escapes {@link LoxParser#parse(String)}.
 */
public class ParseException extends RuntimeException {
    private final transient ParseError error;

    public ParseException(final ParseError error) {
        // thrown once per malformed statement as control flow, so no stack trace
        super(error.toString(), null, false, false);
        this.error = error;
    }

    public ParseError getError() {
        return error;
    }
}
