package io.kassa.core.contract;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kassa.core.amount.Amount;
import io.kassa.core.crypto.HashCode;
import io.kassa.core.crypto.MerchantKeyPair;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ContractTermsTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String merchantPub = MerchantKeyPair.generate(new SecureRandom()).publicKey().toBase32();

    @Test
    void shouldHashIndependentlyOfKeyOrder() throws Exception {
        JsonNode first = MAPPER.readTree("{\"b\":1,\"a\":{\"y\":[1,{\"q\":2,\"p\":3}],\"x\":\"v\"}}");
        JsonNode second = MAPPER.readTree("{\"a\":{\"x\":\"v\",\"y\":[1,{\"p\":3,\"q\":2}]},\"b\":1}");
        JsonNode reordered = MAPPER.readTree("{\"a\":{\"x\":\"v\",\"y\":[{\"p\":3,\"q\":2},1]},\"b\":1}");

        assertThat(CanonicalJson.hash(first)).isEqualTo(CanonicalJson.hash(second));
        assertThat(CanonicalJson.hash(first)).isNotEqualTo(CanonicalJson.hash(reordered));
        assertThat(new String(CanonicalJson.canonicalize(second), StandardCharsets.UTF_8))
            .isEqualTo("{\"a\":{\"x\":\"v\",\"y\":[1,{\"p\":3,\"q\":2}]},\"b\":1}");
    }

    @Test
    void shouldParseTypedFieldsWithDefaults() throws Exception {
        ContractTerms terms = ContractTerms.parse(terms());

        assertThat(terms.orderId()).isEqualTo("order-1");
        assertThat(terms.amount()).isEqualTo(Amount.parse("EUR:10"));
        assertThat(terms.maxWireFee()).isEqualTo(Amount.zero("EUR"));
        assertThat(terms.wireFeeAmortization()).isEqualTo(1);
        assertThat(terms.payDeadline()).isEqualTo(Instant.MAX);
        assertThat(terms.timestamp()).isEqualTo(Instant.ofEpochSecond(5));
        assertThat(terms.hash()).isEqualTo(CanonicalJson.hash(terms()));
        assertThat(terms.currency()).isEqualTo("EUR");
    }

    @Test
    void shouldRejectMissingAmount() {
        ObjectNode json = terms();
        json.remove("amount");

        assertThatThrownBy(() -> ContractTerms.parse(json))
            .isInstanceOf(ContractTermsException.class)
            .hasMessageContaining("amount");
    }

    @Test
    void shouldRejectZeroAmortization() {
        ObjectNode json = terms().put("wire_fee_amortization", 0);

        assertThatThrownBy(() -> ContractTerms.parse(json))
            .isInstanceOf(ContractTermsException.class)
            .hasMessageContaining("wire_fee_amortization");
    }

    @Test
    void shouldRejectRefundDeadlineAfterWireTransferDeadline() {
        ObjectNode json = terms();
        json.set("refund_deadline", Timestamps.toJson(Instant.ofEpochMilli(3_000_000)));

        assertThatThrownBy(() -> ContractTerms.parse(json))
            .isInstanceOf(ContractTermsException.class)
            .hasMessageContaining("refund_deadline");
    }

    @Test
    void shouldRejectMalformedTimestamp() {
        ObjectNode json = terms().put("timestamp", "yesterday");

        assertThatThrownBy(() -> ContractTerms.parse(json)).isInstanceOf(ContractTermsException.class);
    }

    @Test
    void shouldWriteNeverAsString() {
        assertThat(Timestamps.toJson(Instant.MAX).path("t_ms").asText()).isEqualTo("never");
        assertThat(Timestamps.toJson(Instant.ofEpochMilli(42)).path("t_ms").asLong()).isEqualTo(42);
        assertThat(Timestamps.parse(Timestamps.toJson(Instant.MAX))).isEqualTo(Instant.MAX);
    }

    private ObjectNode terms() {
        ObjectNode json = MAPPER.createObjectNode()
            .put("order_id", "order-1")
            .put("amount", "EUR:10")
            .put("max_fee", "EUR:0.5")
            .put("timestamp", "/Date(5)/")
            .put("h_wire", HashCode.sha256("wire").toBase32())
            .put("merchant_pub", merchantPub)
            .put("fulfillment_url", "https://shop.example/article/1");
        json.set("refund_deadline", Timestamps.toJson(Instant.ofEpochMilli(1_000_000)));
        json.set("wire_transfer_deadline", Timestamps.toJson(Instant.ofEpochMilli(2_000_000)));
        json.set("pay_deadline", Timestamps.toJson(Instant.MAX));
        return json;
    }
}
