package me.internalizable.socialflood.cache;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A single cache-key parameter value, tagged with its scalar kind so that
 * integer {@code 5} and string {@code "5"} never encode to the same text.
 */
public record ScalarValue(Kind kind, String text) {

    public enum Kind {
        STRING("s"),
        INT("i"),
        BOOL("b"),
        FLOAT("f");

        private final String tag;

        Kind(String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }
    }

    public ScalarValue {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    public static ScalarValue of(String value) {
        return new ScalarValue(Kind.STRING, value);
    }

    public static ScalarValue of(long value) {
        return new ScalarValue(Kind.INT, Long.toString(value));
    }

    public static ScalarValue of(boolean value) {
        return new ScalarValue(Kind.BOOL, Boolean.toString(value));
    }

    public static ScalarValue of(double value) {
        return new ScalarValue(Kind.FLOAT, Double.toString(value));
    }

    /**
     * Converts a loosely typed value into a scalar.
     *
     * @throws IllegalArgumentException for collections, maps, arrays and any other composite value
     */
    public static ScalarValue from(Object value) {
        Objects.requireNonNull(value, "value");

        if (value instanceof String s) {
            return of(s);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return of(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            return of(((Number) value).doubleValue());
        }
        if (value instanceof Boolean b) {
            return of(b.booleanValue());
        }
        if (value instanceof Enum<?> e) {
            return of(e.name());
        }
        if (value instanceof Character c) {
            return of(c.toString());
        }

        throw new IllegalArgumentException("Cache key parameters must be scalar, got "
                + value.getClass().getName() + "; flatten composite parameters first");
    }

    /**
     * Stable encoding: {@code tag:urlEncodedText}.
     */
    public String encode() {
        return kind.tag() + ":" + URLEncoder.encode(text, StandardCharsets.UTF_8);
    }
}
