package io.kassa.core.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kassa.core.amount.Amount;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import org.junit.jupiter.api.Test;

class MerchantKeyPairTest {
    private final SecureRandom random = new SecureRandom();

    @Test
    void shouldEncodeCrockfordBase32() {
        assertThat(Crockford.encode("foobar".getBytes(StandardCharsets.US_ASCII))).isEqualTo("CSQPYRK1E8");
        assertThat(Crockford.encode(new byte[] {(byte) 0xFF})).isEqualTo("ZW");
        assertThat(Crockford.decode("CSQPYRK1E8")).isEqualTo("foobar".getBytes(StandardCharsets.US_ASCII));
        assertThat(Crockford.decode("csqpyrkie8")).isEqualTo("foobar".getBytes(StandardCharsets.US_ASCII));
        assertThatThrownBy(() -> Crockford.decode("C$")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldHashWithSha256() {
        assertThat(HashCode.sha256("abc").toBase32()).isEqualTo("Q9W1DFWF077YMGA183F5VBH24ER06RD3JRBQN75M23ZP3WG02PPG");
        assertThatThrownBy(() -> HashCode.fromBase32("CSQPYRK1E8")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldSignPaymentConfirmationVerifiably() {
        MerchantKeyPair keys = MerchantKeyPair.generate(random);
        PaymentOkPayload payload = new PaymentOkPayload(HashCode.sha256("contract"));

        byte[] signature = Crockford.decode(keys.signBase32(payload));

        assertThat(signature).hasSize(64);
        assertThat(MerchantKeyPair.verify(keys.publicKey(), payload.toBytes(), signature)).isTrue();
        assertThat(MerchantKeyPair.verify(
            keys.publicKey(),
            new PaymentOkPayload(HashCode.sha256("other")).toBytes(),
            signature
        )).isFalse();
        assertThat(MerchantKeyPair.verify(MerchantKeyPair.generate(random).publicKey(), payload.toBytes(), signature))
            .isFalse();
    }

    @Test
    void shouldPrefixPayloadWithSizeAndPurpose() {
        ByteBuffer ok = ByteBuffer.wrap(new PaymentOkPayload(HashCode.sha256("contract")).toBytes());
        ByteBuffer refund = ByteBuffer.wrap(new RefundRequestPayload(
            HashCode.sha256("contract"),
            MerchantKeyPair.generate(random).publicKey(),
            MerchantKeyPair.generate(random).publicKey(),
            7,
            Amount.parse("EUR:1"),
            Amount.parse("EUR:0.01")
        ).toBytes());

        assertThat(ok.getInt()).isEqualTo(ok.capacity());
        assertThat(ok.getInt()).isEqualTo(SignedPayload.MERCHANT_PAYMENT_OK);
        assertThat(refund.getInt()).isEqualTo(refund.capacity());
        assertThat(refund.getInt()).isEqualTo(SignedPayload.MERCHANT_REFUND);
    }

    @Test
    void shouldRestoreKeyFromSeed() {
        MerchantKeyPair keys = MerchantKeyPair.generate(random);

        MerchantKeyPair restored = MerchantKeyPair.fromBase32(keys.seedBase32());

        assertThat(restored.publicKey()).isEqualTo(keys.publicKey());
        assertThat(EddsaPublicKey.fromBase32(keys.publicKey().toBase32())).isEqualTo(keys.publicKey());
        assertThatThrownBy(() -> MerchantKeyPair.fromSeed(new byte[5])).isInstanceOf(IllegalArgumentException.class);
    }
}
