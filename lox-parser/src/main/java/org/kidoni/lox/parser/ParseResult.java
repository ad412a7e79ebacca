package org.kidoni.lox.parser;

import java.util.List;
import java.util.Objects;

import org.kidoni.lox.ast.Program;

/**
 * Outcome of parsing one source unit: every statement that parsed, in source order, and every
 * error found, ordered by position. A result with errors still carries the statements around them.
 */
public record ParseResult(Program program, List<ParseError> errors) {
    public ParseResult {
        Objects.requireNonNull(program, "program");
        errors = List.copyOf(errors);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public int statementCount() {
        return program.size();
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return program.toString();
        }
        StringBuilder builder = new StringBuilder(program.toString());
        for (ParseError error : errors) {
            if (!builder.isEmpty()) {
                builder.append('\n');
            }
            builder.append(error);
        }
        return builder.toString();
    }
}
