package org.kidoni.lox.parser.conformance;

public record CaseResult(String caseName, boolean success, String description) {
}
