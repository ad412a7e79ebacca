package org.kidoni.lox.ast;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AstPrinterTest {
    private static final Expr A = new Expr.Variable("a");
    private static final Expr B = new Expr.Variable("b");

    @Test
    void printLiterals() {
        assertEquals("nil", AstPrinter.print(Expr.Literal.nil()));
        assertEquals("true", AstPrinter.print(Expr.Literal.bool(true)));
        assertEquals("false", AstPrinter.print(Expr.Literal.bool(false)));
        assertEquals("\"hello world\"", AstPrinter.print(Expr.Literal.string("hello world")));
        assertEquals("\"\"", AstPrinter.print(Expr.Literal.string("")));
    }

    @Test
    void printNumbersWithoutExponentOrTrailingZeros() {
        assertEquals("10", AstPrinter.print(Expr.Literal.number(10)));
        assertEquals("42.5", AstPrinter.print(Expr.Literal.number(42.5)));
        assertEquals("0.1", AstPrinter.print(Expr.Literal.number(0.1)));
        assertEquals("100", AstPrinter.print(Expr.Literal.number(100.0)));
        assertEquals("0", AstPrinter.print(Expr.Literal.number(0)));
        assertEquals("1000000000000000000000", AstPrinter.print(Expr.Literal.number(1e21)));
        assertEquals("NaN", AstPrinter.print(Expr.Literal.number(Double.NaN)));
    }

    @Test
    void printNegativeNumbersAsNegation() {
        Expr minusFive = Expr.Literal.number(-5);

        assertEquals("(-5)", AstPrinter.print(minusFive));
        assertEquals("(-2.5)", AstPrinter.print(Expr.Literal.number(-2.5)));
        assertEquals("(-5)", AstPrinter.print(new Expr.Grouping(minusFive)));
        assertEquals("(-(-5))", AstPrinter.print(new Expr.Unary(UnaryOp.NEGATE, minusFive)));
        assertEquals("((-5) - 1)", AstPrinter.print(new Expr.Binary(minusFive, BinaryOp.SUBTRACT, Expr.Literal.number(1))));
        assertEquals("0", AstPrinter.print(Expr.Literal.number(-0.0)));
    }

    @Test
    void printBinaryFullyParenthesized() {
        // 1 + 2 * 3
        Expr expr = new Expr.Binary(Expr.Literal.number(1), BinaryOp.ADD,
                new Expr.Binary(Expr.Literal.number(2), BinaryOp.MULTIPLY, Expr.Literal.number(3)));
        assertEquals("(1 + (2 * 3))", AstPrinter.print(expr));

        assertEquals("(a and b)", AstPrinter.print(new Expr.Binary(A, BinaryOp.AND, B)));
        assertEquals("(a >= b)", AstPrinter.print(new Expr.Binary(A, BinaryOp.GREATER_EQUAL, B)));
    }

    @Test
    void printUnary() {
        assertEquals("(-a)", AstPrinter.print(new Expr.Unary(UnaryOp.NEGATE, A)));
        assertEquals("(!(!a))", AstPrinter.print(new Expr.Unary(UnaryOp.NOT, new Expr.Unary(UnaryOp.NOT, A))));
        assertEquals("((-a) * b)", AstPrinter.print(
                new Expr.Binary(new Expr.Unary(UnaryOp.NEGATE, A), BinaryOp.MULTIPLY, B)));
    }

    @Test
    void printGroupingKeepsParenthesesVisible() {
        // (1 + 2) * 3
        Expr grouped = new Expr.Binary(
                new Expr.Grouping(new Expr.Binary(Expr.Literal.number(1), BinaryOp.ADD, Expr.Literal.number(2))),
                BinaryOp.MULTIPLY, Expr.Literal.number(3));
        assertEquals("((1 + 2) * 3)", AstPrinter.print(grouped));

        assertEquals("(a)", AstPrinter.print(new Expr.Grouping(A)));
        assertEquals("(a)", AstPrinter.print(new Expr.Grouping(new Expr.Grouping(A))));
        assertEquals("(-a)", AstPrinter.print(new Expr.Grouping(new Expr.Unary(UnaryOp.NEGATE, A))));
    }

    @Test
    void printAssignment() {
        Expr expr = new Expr.Assignment("a", new Expr.Assignment("b", Expr.Literal.number(1)));
        assertEquals("(a = (b = 1))", AstPrinter.print(expr));
    }

    @Test
    void printStatements() {
        assertEquals("(a + b);", AstPrinter.print(new Stmt.Expression(new Expr.Binary(A, BinaryOp.ADD, B))));
        assertEquals("print \"hi\";", AstPrinter.print(new Stmt.Print(Expr.Literal.string("hi"))));
        assertEquals("var x;", AstPrinter.print(new Stmt.VarDeclaration("x", null)));
        assertEquals("var x = 1;", AstPrinter.print(new Stmt.VarDeclaration("x", Expr.Literal.number(1))));
    }

    @Test
    void printBlockAndIf() {
        assertEquals("{ }", AstPrinter.print(new Stmt.Block(List.of())));

        Stmt block = new Stmt.Block(List.of(new Stmt.Print(A), new Stmt.VarDeclaration("c", null)));
        assertEquals("{ print a; var c; }", AstPrinter.print(block));

        assertEquals("if (a) print b;", AstPrinter.print(new Stmt.If(A, new Stmt.Print(B), null)));
        assertEquals("if (a < b) { print a; var c; } else print b;", AstPrinter.print(
                new Stmt.If(new Expr.Binary(A, BinaryOp.LESS, B), block, new Stmt.Print(B))));
    }

    @Test
    void printProgramOneStatementPerLine() {
        Program program = Program.of(
                new Stmt.VarDeclaration("a", Expr.Literal.number(10)),
                new Stmt.Print(A));
        assertEquals("var a = 10;\nprint a;", AstPrinter.print(program));
        assertEquals("", AstPrinter.print(Program.of()));
    }

    @Test
    void toStringIsCanonicalForm() {
        Expr expr = new Expr.Binary(A, BinaryOp.SUBTRACT, B);
        assertEquals(AstPrinter.print(expr), expr.toString());

        Stmt stmt = new Stmt.Print(expr);
        assertEquals("print (a - b);", stmt.toString());
    }
}
