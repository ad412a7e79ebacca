package org.kidoni.lox.parser;

public enum ParseErrorKind {
    /** The scanner could not turn the input into a token, e.g. an unterminated string. */
    LEXICAL_ERROR,
    /** A token other than the ones the grammar allows at this position. */
    UNEXPECTED_TOKEN,
    /** The left side of {@code =} is not a bare identifier. */
    INVALID_ASSIGNMENT_TARGET,
    /** The input ended in the middle of a statement. */
    UNEXPECTED_END_OF_INPUT
}
