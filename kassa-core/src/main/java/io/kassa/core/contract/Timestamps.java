package io.kassa.core.contract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Wire form of absolute times: {@code {"t_ms": millis}} or {@code {"t_ms": "never"}}, with the
 * legacy {@code "/Date(seconds)/"} string still accepted on input.
 */
public final class Timestamps {
    private static final Pattern LEGACY = Pattern.compile("/Date\\((\\d+)\\)/");

    private Timestamps() {
    }

    public static Instant parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new IllegalArgumentException("timestamp missing");
        }
        if (node.isObject()) {
            JsonNode ms = node.get("t_ms");
            if (ms != null && ms.isTextual() && "never".equals(ms.asText())) {
                return Instant.MAX;
            }
            if (ms != null && ms.canConvertToLong()) {
                return Instant.ofEpochMilli(ms.asLong());
            }
        }
        if (node.isTextual()) {
            Matcher matcher = LEGACY.matcher(node.asText());
            if (matcher.matches()) {
                return Instant.ofEpochSecond(Long.parseLong(matcher.group(1)));
            }
        }
        throw new IllegalArgumentException("malformed timestamp: " + node);
    }

    public static JsonNode toJson(Instant instant) {
        if (Instant.MAX.equals(instant)) {
            return JsonNodeFactory.instance.objectNode().put("t_ms", "never");
        }
        return JsonNodeFactory.instance.objectNode().put("t_ms", instant.toEpochMilli());
    }
}
