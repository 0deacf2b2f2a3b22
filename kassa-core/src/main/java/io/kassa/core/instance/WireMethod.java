package io.kassa.core.instance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kassa.core.contract.CanonicalJson;
import io.kassa.core.crypto.HashCode;
import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * One bank account of an instance. {@code jWire} is what the exchange receives on deposit and
 * {@code hWire} is the hash that contracts refer to.
 */
public record WireMethod(JsonNode jWire, HashCode hWire, String wireMethod, boolean active) {

    public WireMethod {
        Objects.requireNonNull(jWire, "jWire must not be null");
        Objects.requireNonNull(hWire, "hWire must not be null");
        Objects.requireNonNull(wireMethod, "wireMethod must not be null");
    }

    public static WireMethod fromPayto(String paytoUri, String salt, boolean active) {
        Objects.requireNonNull(paytoUri, "paytoUri must not be null");
        ObjectNode jWire = JsonNodeFactory.instance.objectNode();
        jWire.put("payto_uri", paytoUri);
        jWire.put("salt", salt == null ? "" : salt);
        return new WireMethod(jWire, CanonicalJson.hash(jWire), methodOf(paytoUri), active);
    }

    static String methodOf(String paytoUri) {
        URI uri = URI.create(paytoUri);
        if (!"payto".equalsIgnoreCase(uri.getScheme()) || uri.getHost() == null) {
            throw new IllegalArgumentException("not a payto URI: " + paytoUri);
        }
        return uri.getHost().toLowerCase(Locale.ROOT);
    }
}
