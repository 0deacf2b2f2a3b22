package io.kassa.core.crypto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Objects;

/**
 * Raw 32-byte Ed25519 public key of a merchant instance, coin or exchange signing key.
 */
public final class EddsaPublicKey {
    public static final int SIZE = 32;

    private final byte[] bytes;

    private EddsaPublicKey(byte[] bytes) {
        if (bytes.length != SIZE) {
            throw new IllegalArgumentException("public key must be " + SIZE + " bytes, got " + bytes.length);
        }
        this.bytes = bytes;
    }

    public static EddsaPublicKey of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        return new EddsaPublicKey(bytes.clone());
    }

    @JsonCreator
    public static EddsaPublicKey fromBase32(String text) {
        return new EddsaPublicKey(Crockford.decode(text));
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    @JsonValue
    public String toBase32() {
        return Crockford.encode(bytes);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof EddsaPublicKey key && Arrays.equals(bytes, key.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toBase32();
    }
}
