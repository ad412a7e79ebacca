package org.kidoni.lox.ast;

import java.math.BigDecimal;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A Lox literal value. Numbers are always IEEE-754 doubles; there is no integer subtype.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Value.Nil.class, name = "Nil"),
        @JsonSubTypes.Type(value = Value.Bool.class, name = "Bool"),
        @JsonSubTypes.Type(value = Value.Number.class, name = "Number"),
        @JsonSubTypes.Type(value = Value.Str.class, name = "String")
})
public sealed interface Value {
    Nil NIL = new Nil();

    record Nil() implements Value {
        @Override
        public String toString() {
            return "nil";
        }
    }

    record Bool(boolean value) implements Value {
        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record Number(double value) implements Value {
        @Override
        public String toString() {
            return format(value);
        }

        /**
         * Plain decimal rendering: integral values drop the fraction and exponents are never used,
         * so the result scans back to the same double.
         */
        static String format(final double value) {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return Double.toString(value);
            }
            return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        }
    }

    record Str(String value) implements Value {
        public Str {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }
}
