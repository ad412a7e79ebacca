package org.kidoni.lox.ast;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Lox statements. {@link Block} and {@link If} are not produced by the current grammar but are
 * kept so trees containing them can still be built, printed and serialized.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Stmt.Expression.class, name = "Expression"),
        @JsonSubTypes.Type(value = Stmt.Print.class, name = "Print"),
        @JsonSubTypes.Type(value = Stmt.VarDeclaration.class, name = "VarDeclaration"),
        @JsonSubTypes.Type(value = Stmt.Block.class, name = "Block"),
        @JsonSubTypes.Type(value = Stmt.If.class, name = "If")
})
public sealed interface Stmt {
    interface Visitor<R> {
        R visitExpression(Expression stmt);

        R visitPrint(Print stmt);

        R visitVarDeclaration(VarDeclaration stmt);

        R visitBlock(Block stmt);

        R visitIf(If stmt);
    }

    <R> R accept(Visitor<R> visitor);

    record Expression(Expr expression) implements Stmt {
        public Expression {
            Objects.requireNonNull(expression, "expression");
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitExpression(this);
        }

        @Override
        public String toString() {
            return AstPrinter.print(this);
        }
    }

    record Print(Expr expression) implements Stmt {
        public Print {
            Objects.requireNonNull(expression, "expression");
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitPrint(this);
        }

        @Override
        public String toString() {
            return AstPrinter.print(this);
        }
    }

    /**
     * @param initializer the initializing expression, or {@code null} for {@code var x;}
     */
    record VarDeclaration(String name, Expr initializer) implements Stmt {
        public VarDeclaration {
            Objects.requireNonNull(name, "name");
        }

        public boolean hasInitializer() {
            return initializer != null;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitVarDeclaration(this);
        }

        @Override
        public String toString() {
            return AstPrinter.print(this);
        }
    }

    record Block(List<Stmt> statements) implements Stmt {
        public Block {
            statements = List.copyOf(statements);
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitBlock(this);
        }

        @Override
        public String toString() {
            return AstPrinter.print(this);
        }
    }

    /**
     * @param elseBranch the else statement, or {@code null} when there is none
     */
    record If(Expr condition, Stmt thenBranch, Stmt elseBranch) implements Stmt {
        public If {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(thenBranch, "thenBranch");
        }

        public boolean hasElseBranch() {
            return elseBranch != null;
        }

        @Override
        public <R> R accept(final Visitor<R> visitor) {
            return visitor.visitIf(this);
        }

        @Override
        public String toString() {
            return AstPrinter.print(this);
        }
    }
}
