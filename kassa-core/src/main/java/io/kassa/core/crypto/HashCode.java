package io.kassa.core.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Objects;

public final class HashCode {
    public static final int SIZE = 32;

    private final byte[] bytes;

    private HashCode(byte[] bytes) {
        if (bytes.length != SIZE) {
            throw new IllegalArgumentException("hash must be " + SIZE + " bytes, got " + bytes.length);
        }
        this.bytes = bytes;
    }

    public static HashCode of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        return new HashCode(bytes.clone());
    }

    public static HashCode fromBase32(String text) {
        return new HashCode(Crockford.decode(text));
    }

    public static HashCode sha256(byte[]... parts) {
        MessageDigest digest = newDigest();
        for (byte[] part : parts) {
            digest.update(part);
        }
        return new HashCode(digest.digest());
    }

    public static HashCode sha256(String text) {
        return sha256(text.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public String toBase32() {
        return Crockford.encode(bytes);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof HashCode hash && Arrays.equals(bytes, hash.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toBase32();
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
