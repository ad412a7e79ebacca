package org.kidoni.lox.parser;

/**
 * Grammar rules, named as they appear in the grammar, used to say where a parse failed.
 */
public enum Production {
    VAR_DECL("varDecl"),
    PRINT_STMT("printStmt"),
    EXPR_STMT("exprStmt"),
    ASSIGNMENT("assignment"),
    LOGIC_OR("logic_or"),
    LOGIC_AND("logic_and"),
    EQUALITY("equality"),
    COMPARISON("comparison"),
    TERM("term"),
    FACTOR("factor"),
    UNARY("unary"),
    PRIMARY("primary");

    private final String rule;

    Production(final String rule) {
        this.rule = rule;
    }

    public String rule() {
        return rule;
    }

    @Override
    public String toString() {
        return rule;
    }
}
