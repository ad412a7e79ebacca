package org.kidoni.lox.parser.conformance;

import java.util.List;

import org.kidoni.lox.ast.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Every backend's parse of one input. The consensus is the program all successful backends
 * agreed on, or {@code null} when none succeeded or any two of them built different trees.
 */
public record ComparisonResult(String input, List<BackendResult> results, Program consensus, AccuracySummary accuracy) {
    private static final Logger log = LoggerFactory.getLogger(ComparisonResult.class);

    public ComparisonResult {
        results = List.copyOf(results);
    }

    public boolean hasConsensus() {
        return consensus != null;
    }

    public void report() {
        if (accuracy.consensusReached()) {
            log.info("consensus: {}/{} parsers agree ({} average)", accuracy.successfulParsers(),
                    accuracy.totalParsers(), accuracy.averageParseTime());
        }
        else if (hasConsensus()) {
            log.info("single result: {}/{} parsers succeeded ({} average)", accuracy.successfulParsers(),
                    accuracy.totalParsers(), accuracy.averageParseTime());
        }
        else {
            log.warn("no consensus: {}/{} parsers succeeded ({} average)", accuracy.successfulParsers(),
                    accuracy.totalParsers(), accuracy.averageParseTime());
        }

        for (BackendResult result : results) {
            if (result.isSuccess()) {
                log.info("  {} {}: {} statement(s) in {}", result.parserName(), result.parserVersion(),
                        result.result().statementCount(), result.parseTime());
            }
            else {
                log.warn("  {} {}: {} error(s) in {}, first {}", result.parserName(), result.parserVersion(),
                        result.result().errors().size(), result.parseTime(), result.result().errors().get(0));
            }
        }
    }
}
