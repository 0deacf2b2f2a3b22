package io.kassa.core.crypto;

import java.security.SecureRandom;
import java.util.Objects;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

/**
 * Ed25519 signing key of a merchant instance. The private part never leaves this class.
 */
public final class MerchantKeyPair {
    private final Ed25519PrivateKeyParameters privateKey;
    private final EddsaPublicKey publicKey;

    private MerchantKeyPair(Ed25519PrivateKeyParameters privateKey) {
        this.privateKey = privateKey;
        this.publicKey = EddsaPublicKey.of(privateKey.generatePublicKey().getEncoded());
    }

    public static MerchantKeyPair fromSeed(byte[] seed) {
        Objects.requireNonNull(seed, "seed must not be null");
        if (seed.length != Ed25519PrivateKeyParameters.KEY_SIZE) {
            throw new IllegalArgumentException("Ed25519 seed must be " + Ed25519PrivateKeyParameters.KEY_SIZE + " bytes");
        }
        return new MerchantKeyPair(new Ed25519PrivateKeyParameters(seed, 0));
    }

    public static MerchantKeyPair fromBase32(String encodedSeed) {
        return fromSeed(Crockford.decode(encodedSeed));
    }

    public static MerchantKeyPair generate(SecureRandom random) {
        return new MerchantKeyPair(new Ed25519PrivateKeyParameters(random));
    }

    public EddsaPublicKey publicKey() {
        return publicKey;
    }

    public String seedBase32() {
        return Crockford.encode(privateKey.getEncoded());
    }

    public byte[] sign(byte[] message) {
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, privateKey);
        signer.update(message, 0, message.length);
        return signer.generateSignature();
    }

    public String signBase32(SignedPayload payload) {
        return Crockford.encode(sign(payload.toBytes()));
    }

    public static boolean verify(EddsaPublicKey key, byte[] message, byte[] signature) {
        Ed25519Signer verifier = new Ed25519Signer();
        verifier.init(false, new Ed25519PublicKeyParameters(key.bytes(), 0));
        verifier.update(message, 0, message.length);
        return verifier.verifySignature(signature);
    }
}
