package org.kidoni.lox.ast;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Lox expressions. Every compound variant owns its children outright; trees are never shared
 * or mutated after construction, so record equality is structural equality.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Expr.Literal.class, name = "Literal"),
        @JsonSubTypes.Type(value = Expr.Variable.class, name = "Variable"),
        @JsonSubTypes.Type(value = Expr.Binary.class, name = "Binary"),
        @JsonSubTypes.Type(value = Expr.Unary.class, name = "Unary"),
        @JsonSubTypes.Type(value = Expr.Grouping.class, name = "Grouping"),
        @JsonSubTypes.Type(value = Expr.Assignment.class, name = "Assignment")
})
public sealed interface Expr {
    interface Visitor<R> {
        R visitLiteral(Literal expr);

        R visitVariable(Variable expr);

        R visitBinary(Binary expr);

        R visitUnary(Unary expr);

        R visitGrouping(Grouping expr);

        R visitAssignment(Assignment expr);
    }

    <R> R accept(Visitor<R> visitor);

    record Literal(Value value) implements Expr {
        public Literal {
            Objects.requireNonNull(value, "value");
        }

        public static Literal number(final double value) {
            return new Literal(new Value.Number(value));
        }

        public static Literal string(final String value) {
            return new Literal(new Value.Str(value));
        }

        public static Literal bool(final boolean value) {
            return new Literal(new Value.Bool(value));
        }

        public static Literal nil() {
            return new Literal(Value.NIL);
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }

        @Override
        public String toString() {
            return AstPrinter.print(this);
        }
    }

    record Variable(String name) implements Expr {
        public Variable {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitVariable(this);
        }

        @Override
        public String toString() {
            return AstPrinter.print(this);
        }
    }

    record Binary(Expr left, BinaryOp operator, Expr right) implements Expr {
        public Binary {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }

        @Override
        public String toString() {
            return AstPrinter.print(this);
        }
    }

    record Unary(UnaryOp operator, Expr operand) implements Expr {
        public Unary {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitUnary(this);
        }

        @Override
        public String toString() {
            return AstPrinter.print(this);
        }
    }

    record Grouping(Expr expression) implements Expr {
        public Grouping {
            Objects.requireNonNull(expression, "expression");
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitGrouping(this);
        }

        @Override
        public String toString() {
            return AstPrinter.print(this);
        }
    }

    record Assignment(String name, Expr value) implements Expr {
        public Assignment {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitAssignment(this);
        }

        @Override
        public String toString() {
            return AstPrinter.print(this);
        }
    }
}
