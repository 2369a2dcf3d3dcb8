package me.internalizable.socialflood.cache;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Ordered set of named scalar parameters used to build cache keys.
 * Entries are kept sorted by name, so insertion order never matters.
 */
public final class CacheParams {

    private static final CacheParams EMPTY = new CacheParams(new TreeMap<>());

    private final SortedMap<String, ScalarValue> entries;

    private CacheParams(SortedMap<String, ScalarValue> entries) {
        this.entries = Collections.unmodifiableSortedMap(entries);
    }

    public static CacheParams empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds parameters from a loosely typed map. Null values are skipped.
     *
     * @throws IllegalArgumentException if any value is not a scalar
     */
    public static CacheParams of(Map<String, ?> values) {
        Builder builder = builder();
        values.forEach(builder::addObject);
        return builder.build();
    }

    public SortedMap<String, ScalarValue> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheParams that)) return false;
        return entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "CacheParams" + entries;
    }

    public static final class Builder {

        private final SortedMap<String, ScalarValue> entries = new TreeMap<>();

        private Builder() {
        }

        public Builder add(String name, String value) {
            return value == null ? this : put(name, ScalarValue.of(value));
        }

        public Builder add(String name, long value) {
            return put(name, ScalarValue.of(value));
        }

        public Builder add(String name, boolean value) {
            return put(name, ScalarValue.of(value));
        }

        public Builder add(String name, double value) {
            return put(name, ScalarValue.of(value));
        }

        public Builder addObject(String name, Object value) {
            return value == null ? this : put(name, ScalarValue.from(value));
        }

        private Builder put(String name, ScalarValue value) {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Parameter name must not be blank");
            }
            if (entries.putIfAbsent(name, value) != null) {
                throw new IllegalArgumentException("Duplicate cache key parameter: " + name);
            }
            return this;
        }

        public CacheParams build() {
            return entries.isEmpty() ? EMPTY : new CacheParams(new TreeMap<>(entries));
        }
    }
}
