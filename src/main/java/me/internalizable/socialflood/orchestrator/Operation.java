package me.internalizable.socialflood.orchestrator;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;

import java.time.Duration;

/**
 * Identifies one upstream operation, e.g. {@code google-news/search}.
 *
 * The value type lets the shared cache tier read a stored result back into the right Java type.
 * {@code defaultTtl} is optional and only used when configuration sets no TTL for the operation.
 */
public record Operation<V>(String namespace, String name, JavaType valueType, Duration defaultTtl) {

    public Operation {
        requireSegment("namespace", namespace);
        requireSegment("name", name);
        if (valueType == null) {
            throw new IllegalArgumentException("valueType is required");
        }
        if (defaultTtl != null && (defaultTtl.isZero() || defaultTtl.isNegative())) {
            throw new IllegalArgumentException("defaultTtl must be positive, got " + defaultTtl);
        }
    }

    public static <V> Operation<V> of(String namespace, String name, Class<V> valueType) {
        return new Operation<>(namespace, name, TypeFactory.defaultInstance().constructType(valueType), null);
    }

    public static <V> Operation<V> of(String namespace, String name, TypeReference<V> valueType) {
        return new Operation<>(namespace, name, TypeFactory.defaultInstance().constructType(valueType), null);
    }

    public Operation<V> withDefaultTtl(Duration ttl) {
        return new Operation<>(namespace, name, valueType, ttl);
    }

    public String qualifiedName() {
        return namespace + "/" + name;
    }

    private static void requireSegment(String label, String value) {
        if (value == null || value.isBlank() || value.indexOf(':') >= 0) {
            throw new IllegalArgumentException(label + " must be non-blank and free of ':' (" + value + ")");
        }
    }
}
