package org.kidoni.lox.parser.conformance;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.kidoni.lox.ast.Program;
import org.kidoni.lox.parser.LoxParser;
import org.kidoni.lox.parser.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks backends against a shared set of inputs and against each other.
 */
public abstract class ConformanceSuite {
    private static final Logger log = LoggerFactory.getLogger(ConformanceSuite.class);

    public static final List<ConformanceCase> STANDARD_CASES = List.of(
            new ConformanceCase("simple_literal", "42;", 1, "Simple number literal"),
            new ConformanceCase("string_literal", "\"Hello, world!\";", 1, "String literal"),
            new ConformanceCase("print_statement", "print \"Hello, world!\";", 1, "Print statement with string"),
            new ConformanceCase("variable_declaration", "var x = 42;", 1, "Variable declaration with initializer"),
            new ConformanceCase("variable_assignment", "var x = 10; x = 20;", 2, "Variable declaration and assignment"),
            new ConformanceCase("arithmetic_expression", "1 + 2 * 3;", 1, "Arithmetic with operator precedence"),
            new ConformanceCase("comparison_expression", "5 > 3;", 1, "Comparison operation"),
            new ConformanceCase("logical_expression", "true and false;", 1, "Logical AND operation"),
            new ConformanceCase("grouped_expression", "(1 + 2) * 3;", 1, "Grouped expression with parentheses"),
            new ConformanceCase("boolean_literals", "true; false; nil;", 3, "Boolean and nil literals"),
            new ConformanceCase("unary_expressions", "-42; !true;", 2, "Unary minus and logical not"),
            new ConformanceCase("complex_arithmetic", "1 + 2 * 3 - 4 / 2;", 1, "Complex arithmetic with multiple operators"),
            new ConformanceCase("multiple_statements", "var a = 10; var b = 20; var sum = a + b; print sum;", 4,
                    "Multiple statements with variables and operations"),
            new ConformanceCase("comments", "// leading comment\nvar x = 42; // trailing\nprint x;", 2,
                    "Line comments are discarded"));

    public static boolean passes(final LoxParser parser, final ConformanceCase testCase) {
        ParseResult result = parser.parse(testCase.input());
        return result.isSuccess() && result.statementCount() == testCase.expectedStatements();
    }

    public static ConformanceSummary run(final LoxParser parser) {
        return run(parser, STANDARD_CASES);
    }

    public static ConformanceSummary run(final LoxParser parser, final List<ConformanceCase> cases) {
        int passed = 0;
        List<CaseResult> results = new ArrayList<>();

        for (ConformanceCase testCase : cases) {
            boolean success = passes(parser, testCase);
            if (success) {
                passed++;
            }
            results.add(new CaseResult(testCase.name(), success, testCase.description()));
        }

        return new ConformanceSummary(parser.name(), passed, cases.size() - passed, cases.size(), results);
    }

    public static List<ConformanceSummary> compareAll(final List<LoxParser> parsers) {
        log.info("testing {} parser(s) with {} case(s)", parsers.size(), STANDARD_CASES.size());

        List<ConformanceSummary> summaries = new ArrayList<>();
        for (LoxParser parser : parsers) {
            ConformanceSummary summary = run(parser);
            summary.report();
            summaries.add(summary);
        }

        for (ConformanceSummary summary : summaries) {
            log.info("{} {}/{} tests passed - {}", summary.status(), summary.passed(), summary.total(),
                    summary.parserName());
        }
        return summaries;
    }

    /**
     * True when every backend prints the same canonical program and reports the same errors for
     * {@code source}. Fewer than two backends are trivially equivalent.
     */
    public static boolean equivalent(final List<LoxParser> parsers, final String source) {
        String expected = null;
        for (LoxParser parser : parsers) {
            String actual = parser.parse(source).toString();
            if (expected == null) {
                expected = actual;
            }
            else if (!expected.equals(actual)) {
                log.warn("{} disagrees on {}: expected {} but was {}", parser.name(), source, expected, actual);
                return false;
            }
        }
        return true;
    }

    /**
     * Parses {@code source} with every backend, timing each parse. The successful backends reach
     * consensus only when there are at least two of them and all built equal trees; a single
     * successful backend still supplies the consensus program.
     */
    public static ComparisonResult compare(final List<LoxParser> parsers, final String source) {
        List<BackendResult> results = new ArrayList<>();
        List<Program> successful = new ArrayList<>();
        Duration total = Duration.ZERO;

        for (LoxParser parser : parsers) {
            long start = System.nanoTime();
            ParseResult result = parser.parse(source);
            Duration parseTime = Duration.ofNanos(System.nanoTime() - start);

            if (result.isSuccess()) {
                successful.add(result.program());
            }
            results.add(new BackendResult(parser.name(), parser.version(), result, parseTime));
            total = total.plus(parseTime);
        }

        Program consensus = null;
        if (!successful.isEmpty() && successful.stream().allMatch(successful.get(0)::equals)) {
            consensus = successful.get(0);
        }

        AccuracySummary accuracy = new AccuracySummary(results.size(), successful.size(),
                results.size() - successful.size(), consensus != null && successful.size() > 1,
                results.isEmpty() ? Duration.ZERO : total.dividedBy(results.size()));

        ComparisonResult comparison = new ComparisonResult(source, results, consensus, accuracy);
        comparison.report();
        return comparison;
    }
}
