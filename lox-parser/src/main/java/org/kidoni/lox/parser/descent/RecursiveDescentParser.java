package org.kidoni.lox.parser.descent;

import org.kidoni.lox.ast.Expr;
import org.kidoni.lox.ast.Value;
import org.kidoni.lox.parser.AbstractLoxParser;
import org.kidoni.lox.parser.Production;
import org.kidoni.lox.parser.Token;
import org.kidoni.lox.parser.TokenCursor;

import static org.kidoni.lox.parser.TokenType.*;

/**
 * Hand-written recursive descent, one method per precedence tier.
 * <p>
 * Grammar:
 * <pre>
 *  expression := assignment
 *  assignment := IDENTIFIER "=" assignment | logic_or
 *  logic_or   := logic_and ( "or" logic_and )*
 *  logic_and  := equality ( "and" equality )*
 *  equality   := comparison ( ( "==" | "!=" ) comparison )*
 *  comparison := term ( ( ">" | ">=" | "<" | "<=" ) term )*
 *  term       := factor ( ( "+" | "-" ) factor )*
 *  factor     := unary ( ( "*" | "/" ) unary )*
 *  unary      := ( "-" | "!" ) unary | primary
 *  primary    := NUMBER | STRING | "true" | "false" | "nil" | IDENTIFIER | "(" expression ")"
 * </pre>
 * Each binary tier parses the next tighter tier and then folds its own operators to the left,
 * so {@code 8 - 4 - 2} is {@code (8 - 4) - 2}.
 */
public class RecursiveDescentParser extends AbstractLoxParser {
    public static final String NAME = "recursive-descent";
    public static final String VERSION = "1.0.0";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String version() {
        return VERSION;
    }

    @Override
    public String description() {
        return "Hand-written recursive descent parser with one method per precedence level";
    }

    @Override
    protected Expr expression(final TokenCursor tokens) {
        return assignment(tokens);
    }

    private Expr assignment(final TokenCursor tokens) {
        Expr expr = or(tokens);

        if (tokens.match(EQUAL)) {
            Token equals = tokens.previous();
            // only a bare name may be assigned; (a) = 1 and a + b = 1 are rejected here
            if (expr instanceof Expr.Variable variable) {
                return new Expr.Assignment(variable.name(), assignment(tokens));
            }
            throw tokens.invalidAssignmentTarget(equals);
        }

        return expr;
    }

    private Expr or(final TokenCursor tokens) {
        Expr expr = and(tokens);

        while (tokens.match(OR)) {
            Token operator = tokens.previous();
            tokens.expectOperand(operator, Production.LOGIC_OR);
            Expr right = and(tokens);
            expr = new Expr.Binary(expr, operator.type().binaryOp(), right);
        }

        return expr;
    }

    private Expr and(final TokenCursor tokens) {
        Expr expr = equality(tokens);

        while (tokens.match(AND)) {
            Token operator = tokens.previous();
            tokens.expectOperand(operator, Production.LOGIC_AND);
            Expr right = equality(tokens);
            expr = new Expr.Binary(expr, operator.type().binaryOp(), right);
        }

        return expr;
    }

    private Expr equality(final TokenCursor tokens) {
        Expr expr = comparison(tokens);

        while (tokens.match(BANG_EQUAL, EQUAL_EQUAL)) {
            Token operator = tokens.previous();
            tokens.expectOperand(operator, Production.EQUALITY);
            Expr right = comparison(tokens);
            expr = new Expr.Binary(expr, operator.type().binaryOp(), right);
        }

        return expr;
    }

    // a < b < c is accepted and groups as (a < b) < c
    private Expr comparison(final TokenCursor tokens) {
        Expr expr = term(tokens);

        while (tokens.match(GREATER, GREATER_EQUAL, LESS, LESS_EQUAL)) {
            Token operator = tokens.previous();
            tokens.expectOperand(operator, Production.COMPARISON);
            Expr right = term(tokens);
            expr = new Expr.Binary(expr, operator.type().binaryOp(), right);
        }

        return expr;
    }

    private Expr term(final TokenCursor tokens) {
        Expr expr = factor(tokens);

        while (tokens.match(MINUS, PLUS)) {
            Token operator = tokens.previous();
            tokens.expectOperand(operator, Production.TERM);
            Expr right = factor(tokens);
            expr = new Expr.Binary(expr, operator.type().binaryOp(), right);
        }

        return expr;
    }

    private Expr factor(final TokenCursor tokens) {
        Expr expr = unary(tokens);

        while (tokens.match(SLASH, STAR)) {
            Token operator = tokens.previous();
            tokens.expectOperand(operator, Production.FACTOR);
            Expr right = unary(tokens);
            expr = new Expr.Binary(expr, operator.type().binaryOp(), right);
        }

        return expr;
    }

    private Expr unary(final TokenCursor tokens) {
        if (tokens.match(BANG, MINUS)) {
            Token operator = tokens.previous();
            tokens.expectOperand(operator, Production.UNARY);
            Expr operand = unary(tokens);
            return new Expr.Unary(operator.type().unaryOp(), operand);
        }

        return primary(tokens);
    }

    private Expr primary(final TokenCursor tokens) {
        if (tokens.match(FALSE)) {
            return new Expr.Literal(new Value.Bool(false));
        }
        if (tokens.match(TRUE)) {
            return new Expr.Literal(new Value.Bool(true));
        }
        if (tokens.match(NIL)) {
            return new Expr.Literal(Value.NIL);
        }

        if (tokens.match(NUMBER, STRING)) {
            return new Expr.Literal(tokens.previous().literal());
        }

        if (tokens.match(IDENTIFIER)) {
            return new Expr.Variable(tokens.previous().lexeme());
        }

        if (tokens.match(LEFT_PAREN)) {
            Expr expr = expression(tokens);
            tokens.consume(RIGHT_PAREN, Production.PRIMARY, "Expect ')' after expression.");
            return new Expr.Grouping(expr);
        }

        throw tokens.error(tokens.peek(), Production.PRIMARY, "Expect expression.");
    }
}
