package org.kidoni.lox.parser;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * A parser backend. Every backend accepts the same language and must produce the same trees
 * and errors for the same input; only the parsing technique differs.
 * <p>
 * Implementations are stateless, so one instance may parse any number of sources, from any
 * number of threads.
 */
public interface LoxParser {
    String name();

    String version();

    String description();

    /**
     * Parses a complete source unit. Malformed input is reported through
     * {@link ParseResult#errors()}, never thrown.
     */
    ParseResult parse(String source);

    /**
     * Reads UTF-8 source text to the end of the stream and parses it.
     */
    default ParseResult parse(final InputStream inputStream) {
        try {
            return parse(new String(inputStream.readAllBytes(), StandardCharsets.UTF_8));
        }
        catch (IOException e) {
            throw new UncheckedIOException("unable to read source", e);
        }
    }
}
