package org.kidoni.lox.parser.conformance;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.kidoni.lox.ast.Expr;
import org.kidoni.lox.ast.Program;
import org.kidoni.lox.ast.Stmt;
import org.kidoni.lox.parser.LoxParser;
import org.kidoni.lox.parser.LoxParsers;
import org.kidoni.lox.parser.ParseResult;
import org.kidoni.lox.parser.descent.RecursiveDescentParser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConformanceSuiteTest {
    /** Accepts everything and returns nothing, so it fails every case that expects statements. */
    private static final LoxParser EMPTY_PARSER = new LoxParser() {
        @Override
        public String name() {
            return "empty";
        }

        @Override
        public String version() {
            return "0";
        }

        @Override
        public String description() {
            return "returns an empty program";
        }

        @Override
        public ParseResult parse(final String source) {
            return new ParseResult(Program.of(), List.of());
        }
    };

    /** Succeeds on every input with the same one-statement program. */
    private static final LoxParser PRINT_TWO_PARSER = new LoxParser() {
        @Override
        public String name() {
            return "print-two";
        }

        @Override
        public String version() {
            return "0";
        }

        @Override
        public String description() {
            return "always returns print 2;";
        }

        @Override
        public ParseResult parse(final String source) {
            return new ParseResult(Program.of(new Stmt.Print(Expr.Literal.number(2))), List.of());
        }
    };

    @Test
    void everyRegisteredBackendPassesStandardCases() {
        List<ConformanceSummary> summaries = ConformanceSuite.compareAll(LoxParsers.all());

        assertEquals(2, summaries.size());
        for (ConformanceSummary summary : summaries) {
            assertTrue(summary.allPassed(), () -> summary.parserName() + " failed " + summary.failures());
            assertEquals(ConformanceSuite.STANDARD_CASES.size(), summary.total());
            assertEquals("WORKING", summary.status());
        }
    }

    @Test
    void summaryCountsFailures() {
        List<ConformanceCase> cases = List.of(
                new ConformanceCase("ok", "print 1;", 1, "valid"),
                new ConformanceCase("bad", "var = ;", 1, "missing name"),
                new ConformanceCase("wrong_count", "1; 2;", 1, "two statements"));

        ConformanceSummary summary = ConformanceSuite.run(new RecursiveDescentParser(), cases);
        summary.report();

        assertEquals(1, summary.passed());
        assertEquals(2, summary.failed());
        assertEquals("PARTIAL", summary.status());
        assertEquals(List.of("bad", "wrong_count"), summary.failures().stream().map(CaseResult::caseName).toList());
        assertEquals(100.0 / 3, summary.successRate(), 1e-9);
    }

    @Test
    void brokenBackend() {
        ConformanceSummary summary = ConformanceSuite.run(EMPTY_PARSER);
        summary.report();

        assertEquals(0, summary.passed());
        assertEquals("BROKEN", summary.status());
    }

    @Test
    void backendsAgreeOnValidAndInvalidInput() {
        List<LoxParser> parsers = LoxParsers.all();

        for (String source : List.of(
                "var a = 10; var b = 20; var sum = a + b; print sum;",
                "a = b = c or d and !e == -f;",
                "var x = ; print x;",
                "1 = 2; (a) = 3; print \"unterminated",
                "print print 1; var = 2; ) ) var y = (1 + ;")) {
            assertTrue(ConformanceSuite.equivalent(parsers, source), source);
        }
    }

    @Test
    void disagreementIsDetected() {
        assertFalse(ConformanceSuite.equivalent(List.of(new RecursiveDescentParser(), EMPTY_PARSER), "print 1;"));
        assertTrue(ConformanceSuite.equivalent(List.of(EMPTY_PARSER), "print 1;"));
    }

    @Test
    void agreeingBackendsReachConsensus() {
        ComparisonResult comparison = ConformanceSuite.compare(LoxParsers.all(), "var a = 1; print a + 2;");

        assertTrue(comparison.hasConsensus());
        assertEquals("var a = 1;\nprint (a + 2);", comparison.consensus().toString());
        assertEquals(List.of("recursive-descent", "precedence-climbing"),
                comparison.results().stream().map(BackendResult::parserName).toList());

        AccuracySummary accuracy = comparison.accuracy();
        assertEquals(2, accuracy.totalParsers());
        assertEquals(2, accuracy.successfulParsers());
        assertEquals(0, accuracy.failedParsers());
        assertTrue(accuracy.consensusReached());
        assertFalse(accuracy.averageParseTime().isNegative());
    }

    @Test
    void disagreeingBackendBreaksConsensus() {
        ComparisonResult comparison = ConformanceSuite.compare(
                List.of(new RecursiveDescentParser(), PRINT_TWO_PARSER), "print 1;");

        assertFalse(comparison.hasConsensus());
        assertNull(comparison.consensus());
        assertEquals(2, comparison.accuracy().successfulParsers());
        assertFalse(comparison.accuracy().consensusReached());
    }

    @Test
    void failedBackendsAreLeftOutOfConsensus() {
        ComparisonResult comparison = ConformanceSuite.compare(
                List.of(new RecursiveDescentParser(), PRINT_TWO_PARSER), "print ;");

        assertEquals(Program.of(new Stmt.Print(Expr.Literal.number(2))), comparison.consensus());
        assertEquals(1, comparison.accuracy().successfulParsers());
        assertEquals(1, comparison.accuracy().failedParsers());
        // a lone successful backend supplies a program but is no consensus
        assertFalse(comparison.accuracy().consensusReached());
        assertFalse(comparison.results().get(0).isSuccess());
    }

    @Test
    void noSuccessfulBackendMeansNoConsensus() {
        ComparisonResult comparison = ConformanceSuite.compare(LoxParsers.all(), "var = ;");

        assertFalse(comparison.hasConsensus());
        assertEquals(2, comparison.accuracy().failedParsers());
        assertFalse(comparison.accuracy().consensusReached());
    }
}
