package org.kidoni.lox.parser.climbing;

import java.util.EnumMap;
import java.util.Map;

import org.kidoni.lox.ast.Expr;
import org.kidoni.lox.ast.Value;
import org.kidoni.lox.parser.AbstractLoxParser;
import org.kidoni.lox.parser.Production;
import org.kidoni.lox.parser.Token;
import org.kidoni.lox.parser.TokenCursor;
import org.kidoni.lox.parser.TokenType;

import static org.kidoni.lox.parser.TokenType.*;

/**
 * Table-driven precedence climbing. All binary operators go through one loop that only accepts
 * operators binding at least as tightly as the current minimum; the right operand is parsed one
 * level tighter, which makes every binary operator left-associative.
 * <p>
 * Levels, loosest first:
 * <pre>
 *  1  or
 *  2  and
 *  3  ==  !=
 *  4  &gt;  &gt;=  &lt;  &lt;=
 *  5  +  -
 *  6  *  /
 * </pre>
 * Unary prefixes, primaries and assignment sit outside the table.
 */
public class PrecedenceClimbingParser extends AbstractLoxParser {
    public static final String NAME = "precedence-climbing";
    public static final String VERSION = "1.0.0";

    private static final int LOWEST = 1;

    private static final Map<TokenType, Level> LEVELS = new EnumMap<>(TokenType.class);

    static {
        level(1, Production.LOGIC_OR, OR);
        level(2, Production.LOGIC_AND, AND);
        level(3, Production.EQUALITY, EQUAL_EQUAL, BANG_EQUAL);
        level(4, Production.COMPARISON, GREATER, GREATER_EQUAL, LESS, LESS_EQUAL);
        level(5, Production.TERM, PLUS, MINUS);
        level(6, Production.FACTOR, STAR, SLASH);
    }

    /**
     * Binding strength of an operator, with the grammar rule it belongs to for error reporting.
     */
    private record Level(int precedence, Production production) {
    }

    private static void level(final int precedence, final Production production, final TokenType... operators) {
        for (TokenType operator : operators) {
            LEVELS.put(operator, new Level(precedence, production));
        }
    }

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
        return "Operator-precedence table with a minimum-precedence climbing loop";
    }

    @Override
    protected Expr expression(final TokenCursor tokens) {
        Expr target = binary(tokens, LOWEST);

        if (tokens.match(EQUAL)) {
            Token equals = tokens.previous();
            if (target instanceof Expr.Variable variable) {
                // right-associative: a = b = 1 assigns (b = 1) to a
                return new Expr.Assignment(variable.name(), expression(tokens));
            }
            throw tokens.invalidAssignmentTarget(equals);
        }

        return target;
    }

    private Expr binary(final TokenCursor tokens, final int minPrecedence) {
        Expr left = unary(tokens);

        while (true) {
            Level level = LEVELS.get(tokens.peek().type());
            if (level == null || level.precedence() < minPrecedence) {
                return left;
            }

            Token operator = tokens.advance();
            tokens.expectOperand(operator, level.production());
            Expr right = binary(tokens, level.precedence() + 1);
            left = new Expr.Binary(left, operator.type().binaryOp(), right);
        }
    }

    private Expr unary(final TokenCursor tokens) {
        if (tokens.match(BANG, MINUS)) {
            Token operator = tokens.previous();
            tokens.expectOperand(operator, Production.UNARY);
            return new Expr.Unary(operator.type().unaryOp(), unary(tokens));
        }
        return primary(tokens);
    }

    private Expr primary(final TokenCursor tokens) {
        Token token = tokens.peek();
        switch (token.type()) {
            case TRUE, FALSE -> {
                tokens.advance();
                return new Expr.Literal(new Value.Bool(token.is(TRUE)));
            }
            case NIL -> {
                tokens.advance();
                return new Expr.Literal(Value.NIL);
            }
            case NUMBER, STRING -> {
                tokens.advance();
                return new Expr.Literal(token.literal());
            }
            case IDENTIFIER -> {
                tokens.advance();
                return new Expr.Variable(token.lexeme());
            }
            case LEFT_PAREN -> {
                tokens.advance();
                Expr inner = expression(tokens);
                tokens.consume(RIGHT_PAREN, Production.PRIMARY, "Expect ')' after expression.");
                return new Expr.Grouping(inner);
            }
            default -> throw tokens.error(token, Production.PRIMARY, "Expect expression.");
        }
    }
}
