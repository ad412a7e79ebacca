package org.kidoni.lox.parser;

import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovers the parser backends registered under {@code META-INF/services}.
 * <p>
 * The default backend is named by the {@code lox.parser} system property, then the
 * {@code LOX_PARSER} environment variable, then {@link #DEFAULT_PARSER}.
 */
public abstract class LoxParsers {
    public static final String DEFAULT_PARSER = "recursive-descent";
    public static final String PARSER_PROPERTY = "lox.parser";
    public static final String PARSER_ENV = "LOX_PARSER";

    private static final Logger log = LoggerFactory.getLogger(LoxParsers.class);

    public static List<LoxParser> all() {
        return ServiceLoader.load(LoxParser.class).stream()
                .map(ServiceLoader.Provider::get)
                .collect(Collectors.toUnmodifiableList());
    }

    public static Optional<LoxParser> byName(final String name) {
        return all().stream()
                .filter(parser -> parser.name().equals(name))
                .findFirst();
    }

    public static LoxParser defaultParser() {
        String env = System.getenv(PARSER_ENV);
        String name = System.getProperty(PARSER_PROPERTY, env != null ? env : DEFAULT_PARSER);

        LoxParser parser = byName(name).orElseThrow(() -> new IllegalArgumentException(
                "unknown parser '" + name + "', available: " + names()));
        log.debug("using parser backend {}", parser);
        return parser;
    }

    private static String names() {
        return all().stream().map(LoxParser::name).collect(Collectors.joining(", "));
    }
}
