package org.kidoni.lox.parser.conformance;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.kidoni.lox.parser.climbing.PrecedenceClimbingParser;
import org.kidoni.lox.parser.descent.RecursiveDescentParser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParserBenchmarkTest {
    @Test
    void countsSuccessfulParses() {
        BenchmarkResult result = ParserBenchmark.run(new RecursiveDescentParser(), "var x = (1 + 2) * 3; print x;", 1000);

        assertEquals(1000, result.successes());
        assertTrue(result.allSucceeded());
        assertEquals("recursive-descent", result.parserName());
        assertTrue(result.average().compareTo(result.elapsed()) <= 0);
    }

    @Test
    void failedParsesAreNotCounted() {
        BenchmarkResult result = ParserBenchmark.run(new PrecedenceClimbingParser(), "var x = ;", 10);

        assertEquals(0, result.successes());
        assertFalse(result.allSucceeded());
    }

    @Test
    void averageOfNothing() {
        assertEquals(Duration.ZERO, new BenchmarkResult("none", Duration.ofMillis(5), 0, 0).average());
    }

    @Test
    void iterationsMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> ParserBenchmark.run(new RecursiveDescentParser(), "1;", 0));
    }
}
