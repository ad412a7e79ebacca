package org.kidoni.lox.ast;

import java.util.stream.Collectors;

/**
 * Renders syntax trees in canonical form.
 * <p>
 * Every compound expression is fully parenthesized, so the output shows exactly how operators
 * were grouped regardless of the original spacing:
 * <pre>
 *  1 + 2 * 3      (1 + (2 * 3))
 *  (1 + 2) * 3    ((1 + 2) * 3)
 *  -a * b         ((-a) * b)
 *  a = b = 1      (a = (b = 1))
 * </pre>
 * A negative number literal prints as {@code (-5)}, the same text as negation applied to
 * {@code 5}, since the scanner has no signed numbers.
 * A grouping around an expression that already prints its own parentheses adds no second pair,
 * which keeps printing stable when canonical text is parsed and printed again. Two trees that
 * print the same are treated as equivalent parses.
 */
public final class AstPrinter implements Expr.Visitor<String>, Stmt.Visitor<String> {
    private static final AstPrinter INSTANCE = new AstPrinter();

    private AstPrinter() {
    }

    public static String print(final Expr expr) {
        return expr.accept(INSTANCE);
    }

    public static String print(final Stmt stmt) {
        return stmt.accept(INSTANCE);
    }

    public static String print(final Program program) {
        return program.statements().stream()
                .map(stmt -> print(stmt))
                .collect(Collectors.joining("\n"));
    }

    @Override
    public String visitLiteral(final Expr.Literal expr) {
        // -5 would scan back as negation applied to 5, so a negative number prints in that shape
        if (isNegativeNumber(expr)) {
            return "(-" + Value.Number.format(-((Value.Number) expr.value()).value()) + ")";
        }
        return expr.value().toString();
    }

    @Override
    public String visitVariable(final Expr.Variable expr) {
        return expr.name();
    }

    @Override
    public String visitBinary(final Expr.Binary expr) {
        return "(" + expr.left().accept(this) + " " + expr.operator().lexeme() + " " + expr.right().accept(this) + ")";
    }

    @Override
    public String visitUnary(final Expr.Unary expr) {
        return "(" + expr.operator().lexeme() + expr.operand().accept(this) + ")";
    }

    @Override
    public String visitGrouping(final Expr.Grouping expr) {
        String inner = expr.expression().accept(this);
        if (isAtom(expr.expression())) {
            return "(" + inner + ")";
        }
        return inner;
    }

    @Override
    public String visitAssignment(final Expr.Assignment expr) {
        return "(" + expr.name() + " = " + expr.value().accept(this) + ")";
    }

    @Override
    public String visitExpression(final Stmt.Expression stmt) {
        return stmt.expression().accept(this) + ";";
    }

    @Override
    public String visitPrint(final Stmt.Print stmt) {
        return "print " + stmt.expression().accept(this) + ";";
    }

    @Override
    public String visitVarDeclaration(final Stmt.VarDeclaration stmt) {
        if (stmt.hasInitializer()) {
            return "var " + stmt.name() + " = " + stmt.initializer().accept(this) + ";";
        }
        return "var " + stmt.name() + ";";
    }

    @Override
    public String visitBlock(final Stmt.Block stmt) {
        StringBuilder builder = new StringBuilder("{");
        for (Stmt statement : stmt.statements()) {
            builder.append(' ').append(statement.accept(this));
        }
        return builder.append(" }").toString();
    }

    @Override
    public String visitIf(final Stmt.If stmt) {
        StringBuilder builder = new StringBuilder("if ")
                .append(parenthesized(stmt.condition()))
                .append(' ')
                .append(stmt.thenBranch().accept(this));
        if (stmt.hasElseBranch()) {
            builder.append(" else ").append(stmt.elseBranch().accept(this));
        }
        return builder.toString();
    }

    private String parenthesized(final Expr expr) {
        String text = expr.accept(this);
        return isAtom(expr) ? "(" + text + ")" : text;
    }

    // literals and variables are the only expressions printed without their own parentheses
    private static boolean isAtom(final Expr expr) {
        if (expr instanceof Expr.Literal literal) {
            return !isNegativeNumber(literal);
        }
        return expr instanceof Expr.Variable;
    }

    private static boolean isNegativeNumber(final Expr.Literal literal) {
        return literal.value() instanceof Value.Number number && number.value() < 0;
    }
}
