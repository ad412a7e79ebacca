package org.kidoni.lox.parser.conformance;

import java.time.Duration;

public record BenchmarkResult(String parserName, Duration elapsed, int successes, int iterations) {
    public Duration average() {
        return iterations == 0 ? Duration.ZERO : elapsed.dividedBy(iterations);
    }

    public boolean allSucceeded() {
        return successes == iterations;
    }
}
