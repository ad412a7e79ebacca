package org.kidoni.lox.parser.conformance;

import java.time.Duration;

public record AccuracySummary(int totalParsers, int successfulParsers, int failedParsers, boolean consensusReached,
        Duration averageParseTime) {
}
