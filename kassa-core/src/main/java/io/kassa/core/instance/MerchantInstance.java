package io.kassa.core.instance;

import io.kassa.core.crypto.EddsaPublicKey;
import io.kassa.core.crypto.HashCode;
import io.kassa.core.crypto.MerchantKeyPair;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Read-only merchant instance. Request handlers {@link #retain()} it on entry and
 * {@link #release()} it when their context is cleaned up.
 */
public final class MerchantInstance {
    public static final String DEFAULT_ID = "default";

    private final String id;
    private final MerchantKeyPair keys;
    private final List<WireMethod> wireMethods;
    private final AtomicInteger references;

    public MerchantInstance(String id, MerchantKeyPair keys, List<WireMethod> wireMethods) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.keys = Objects.requireNonNull(keys, "keys must not be null");
        this.wireMethods = List.copyOf(wireMethods);
        this.references = new AtomicInteger(1);
    }

    public String id() {
        return id;
    }

    public boolean isDefault() {
        return DEFAULT_ID.equals(id);
    }

    public EddsaPublicKey publicKey() {
        return keys.publicKey();
    }

    public MerchantKeyPair keys() {
        return keys;
    }

    public List<WireMethod> wireMethods() {
        return wireMethods;
    }

    public Optional<WireMethod> findWireMethod(HashCode hWire) {
        return wireMethods.stream().filter(wm -> wm.hWire().equals(hWire)).findFirst();
    }

    public MerchantInstance retain() {
        references.incrementAndGet();
        return this;
    }

    public void release() {
        if (references.decrementAndGet() < 0) {
            throw new IllegalStateException("instance " + id + " released more often than retained");
        }
    }

    public int references() {
        return references.get();
    }
}
