package org.kidoni.lox.parser.conformance;

/**
 * A source snippet every backend must accept, with the number of statements it must yield.
 */
public record ConformanceCase(String name, String input, int expectedStatements, String description) {
}
