package org.kidoni.lox.parser;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.kidoni.lox.ast.Expr;
import org.kidoni.lox.ast.Program;
import org.kidoni.lox.ast.Stmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.kidoni.lox.parser.TokenType.EQUAL;
import static org.kidoni.lox.parser.TokenType.IDENTIFIER;
import static org.kidoni.lox.parser.TokenType.PRINT;
import static org.kidoni.lox.parser.TokenType.SEMICOLON;
import static org.kidoni.lox.parser.TokenType.VAR;

/**
 * Statement-level half of the grammar, shared by every backend:
 * <pre>
 *  program   := statement* EOF
 *  statement := varDecl | printStmt | exprStmt
 *  varDecl   := "var" IDENTIFIER ( "=" expression )? ";"
 *  printStmt := "print" expression ";"
 *  exprStmt  := expression ";"
 * </pre>
 * Subclasses supply {@link #expression(TokenCursor)}. A statement that fails is dropped, its
 * single error recorded, and parsing resumes at the next statement boundary.
 */
public abstract class AbstractLoxParser implements LoxParser {
    private static final Logger log = LoggerFactory.getLogger(AbstractLoxParser.class);

    private static final Comparator<ParseError> BY_POSITION =
            Comparator.comparingInt(ParseError::line).thenComparingInt(ParseError::column);

    @Override
    public final ParseResult parse(final String source) {
        List<Token> tokens = new Scanner(source).scanTokens();
        TokenCursor cursor = new TokenCursor(tokens);

        List<Stmt> statements = new ArrayList<>();
        List<ParseError> errors = new ArrayList<>();

        while (!cursor.isAtEnd()) {
            int start = cursor.position();
            try {
                statements.add(statement(cursor));
            }
            catch (ParseException e) {
                log.debug("{}: {}", name(), e.getError());
                errors.add(e.getError());
                cursor.synchronize();
            }

            if (cursor.position() == start) {
                throw new IllegalStateException(name() + " made no progress at " + cursor.peek());
            }
        }

        errors.sort(BY_POSITION);
        log.debug("{} parsed {} statement(s) with {} error(s)", name(), statements.size(), errors.size());
        return new ParseResult(new Program(statements), errors);
    }

    /**
     * Parses a single expression starting at the cursor, leaving the cursor on the first token
     * after it.
     *
     * @throws ParseException if no expression can be parsed here
     */
    protected abstract Expr expression(TokenCursor tokens);

    private Stmt statement(final TokenCursor tokens) {
        if (tokens.match(VAR)) {
            return varDeclaration(tokens);
        }
        if (tokens.match(PRINT)) {
            return printStatement(tokens);
        }
        return expressionStatement(tokens);
    }

    private Stmt varDeclaration(final TokenCursor tokens) {
        Token name = tokens.consume(IDENTIFIER, Production.VAR_DECL, "Expect variable name.");

        Expr initializer = null;
        if (tokens.match(EQUAL)) {
            initializer = expression(tokens);
        }

        tokens.consume(SEMICOLON, Production.VAR_DECL, "Expect ';' after variable declaration.");
        return new Stmt.VarDeclaration(name.lexeme(), initializer);
    }

    private Stmt printStatement(final TokenCursor tokens) {
        Expr value = expression(tokens);
        tokens.consume(SEMICOLON, Production.PRINT_STMT, "Expect ';' after value.");
        return new Stmt.Print(value);
    }

    private Stmt expressionStatement(final TokenCursor tokens) {
        Expr expr = expression(tokens);
        tokens.consume(SEMICOLON, Production.EXPR_STMT, "Expect ';' after expression.");
        return new Stmt.Expression(expr);
    }

    @Override
    public String toString() {
        return name() + " " + version();
    }
}
