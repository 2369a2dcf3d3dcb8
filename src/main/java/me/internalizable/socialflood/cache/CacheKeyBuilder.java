package me.internalizable.socialflood.cache;

import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Builds cache keys of the form {@code namespace:operation[:name=tag:value&...]}.
 *
 * Pure function of its inputs: parameters are visited in name order, values carry a
 * type tag and are URL-encoded, so identical calls always address the same slot and
 * unrelated calls cannot collide. Keys longer than {@value #MAX_KEY_LENGTH} characters
 * keep their {@code namespace:operation:} prefix and hash the parameter section.
 */
@Component
public class CacheKeyBuilder {

    static final int MAX_KEY_LENGTH = 250;

    public String build(String namespace, String operation, CacheParams params) {
        requireSegment("namespace", namespace);
        requireSegment("operation", operation);

        String prefix = namespace + ":" + operation;
        if (params == null || params.isEmpty()) {
            return prefix;
        }

        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, ScalarValue> entry : params.entries().entrySet()) {
            joiner.add(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8) + "=" + entry.getValue().encode());
        }

        String key = prefix + ":" + joiner;
        if (key.length() > MAX_KEY_LENGTH) {
            // hashed sections never contain '=' so they cannot clash with a raw one
            return prefix + ":h" + DigestUtils.md5DigestAsHex(joiner.toString().getBytes(StandardCharsets.UTF_8));
        }
        return key;
    }

    /**
     * Prefix shared by every key of a namespace.
     */
    public String namespacePrefix(String namespace) {
        requireSegment("namespace", namespace);
        return namespace + ":";
    }

    private static void requireSegment(String label, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(label + " must not be blank");
        }
        if (value.indexOf(':') >= 0) {
            throw new IllegalArgumentException(label + " must not contain ':' (" + value + ")");
        }
    }
}
