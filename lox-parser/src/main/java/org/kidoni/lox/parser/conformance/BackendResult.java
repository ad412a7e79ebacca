package org.kidoni.lox.parser.conformance;

import java.time.Duration;
import java.util.Objects;

import org.kidoni.lox.parser.ParseResult;

/**
 * One backend's parse of a shared input, with the time the parse took.
 */
public record BackendResult(String parserName, String parserVersion, ParseResult result, Duration parseTime) {
    public BackendResult {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(parseTime, "parseTime");
    }

    public boolean isSuccess() {
        return result.isSuccess();
    }
}
