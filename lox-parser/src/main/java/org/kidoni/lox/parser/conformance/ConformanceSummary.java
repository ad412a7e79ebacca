package org.kidoni.lox.parser.conformance;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public record ConformanceSummary(String parserName, int passed, int failed, int total, List<CaseResult> results) {
    private static final Logger log = LoggerFactory.getLogger(ConformanceSummary.class);

    public ConformanceSummary {
        results = List.copyOf(results);
    }

    public boolean allPassed() {
        return passed == total;
    }

    public double successRate() {
        return total == 0 ? 0.0 : passed * 100.0 / total;
    }

    public List<CaseResult> failures() {
        return results.stream().filter(result -> !result.success()).toList();
    }

    public String status() {
        if (allPassed()) {
            return "WORKING";
        }
        return passed > 0 ? "PARTIAL" : "BROKEN";
    }

    public void report() {
        if (allPassed()) {
            log.info("{}: SUCCESS, all tests passed ({}/{})", parserName, passed, total);
            return;
        }

        if (passed > 0) {
            log.warn("{}: PARTIAL, {}/{} tests passed ({}%)", parserName, passed, total,
                    String.format("%.1f", successRate()));
        }
        else {
            log.warn("{}: FAILED, all tests failed ({}/{})", parserName, failed, total);
        }

        for (CaseResult failure : failures()) {
            log.warn("  failed {}: {}", failure.caseName(), failure.description());
        }
    }
}
