package org.kidoni.lox.parser.conformance;

import java.time.Duration;

import org.kidoni.lox.parser.LoxParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class ParserBenchmark {
    private static final Logger log = LoggerFactory.getLogger(ParserBenchmark.class);

    /**
     * Parses {@code input} {@code iterations} times, counting the parses that reported no errors.
     */
    public static BenchmarkResult run(final LoxParser parser, final String input, final int iterations) {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be greater than 0");
        }

        int successes = 0;
        long start = System.nanoTime();
        for (int i = 0; i < iterations; i++) {
            if (parser.parse(input).isSuccess()) {
                successes++;
            }
        }

        BenchmarkResult result = new BenchmarkResult(parser.name(), Duration.ofNanos(System.nanoTime() - start),
                successes, iterations);
        log.info("{}: {} iterations in {} ({} per parse)", parser.name(), iterations, result.elapsed(),
                result.average());
        return result;
    }
}
