package org.kidoni.lox.ast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON form of syntax trees. Each node carries a {@code type} discriminator naming its variant,
 * and reading the output back yields a tree equal to the one written.
 */
public final class AstJson {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private AstJson() {
    }

    public static String write(final Program program) {
        return writeValue(program);
    }

    public static String write(final Stmt stmt) {
        return writeValue(stmt);
    }

    public static String write(final Expr expr) {
        return writeValue(expr);
    }

    public static Program readProgram(final String json) {
        return readValue(json, Program.class);
    }

    public static Stmt readStmt(final String json) {
        return readValue(json, Stmt.class);
    }

    public static Expr readExpr(final String json) {
        return readValue(json, Expr.class);
    }

    private static String writeValue(final Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        }
        catch (JsonProcessingException e) {
            throw new AstJsonException("unable to write syntax tree as JSON", e);
        }
    }

    private static <T> T readValue(final String json, final Class<T> type) {
        try {
            T value = MAPPER.readValue(json, type);
            if (value == null) {
                throw new AstJsonException("JSON document is null, expected " + type.getSimpleName());
            }
            return value;
        }
        catch (JsonProcessingException e) {
            throw new AstJsonException("malformed " + type.getSimpleName() + " JSON: " + e.getOriginalMessage(), e);
        }
    }
}
