package org.kidoni.lox.ast;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A parsed source unit. Statements are kept in source order.
 */
public record Program(List<Stmt> statements) {
    public Program {
        statements = List.copyOf(statements);
    }

    public static Program of(final Stmt... statements) {
        return new Program(List.of(statements));
    }

    public int size() {
        return statements.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public String toString() {
        return AstPrinter.print(this);
    }
}
