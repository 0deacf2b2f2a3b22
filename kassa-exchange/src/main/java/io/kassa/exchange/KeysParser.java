package io.kassa.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import io.kassa.core.amount.Amount;
import io.kassa.core.contract.Timestamps;
import io.kassa.core.exchange.Denomination;
import io.kassa.core.exchange.ExchangeAuditor;
import io.kassa.core.exchange.ExchangeKeys;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Reads the parts of an exchange's {@code /keys} and {@code /wire} replies the merchant needs.
 */
final class KeysParser {

    private KeysParser() {
    }

    static ExchangeKeys parseKeys(JsonNode keys) {
        if (keys == null || !keys.isObject()) {
            throw new IllegalArgumentException("keys reply is not a JSON object");
        }
        String masterPub = requiredText(keys, "master_public_key");
        List<Denomination> denominations = new ArrayList<>();
        for (JsonNode denom : keys.path("denoms")) {
            denominations.add(new Denomination(
                requiredText(denom, "denom_pub"),
                Amount.parse(requiredText(denom, "value")),
                Amount.parse(requiredText(denom, "fee_deposit")),
                Amount.parse(requiredText(denom, "fee_refund")),
                Timestamps.parse(denom.get("stamp_expire_deposit"))
            ));
        }
        List<ExchangeAuditor> auditors = new ArrayList<>();
        for (JsonNode auditor : keys.path("auditors")) {
            Set<String> denomPubs = new HashSet<>();
            for (JsonNode vouched : auditor.path("denomination_keys")) {
                denomPubs.add(requiredText(vouched, "denom_pub"));
            }
            auditors.add(new ExchangeAuditor(
                requiredText(auditor, "auditor_pub"),
                auditor.path("auditor_url").asText(""),
                denomPubs
            ));
        }
        String currency = keys.hasNonNull("currency")
            ? keys.get("currency").asText()
            : denominations.stream().findFirst().map(d -> d.value().currency()).orElse("");
        if (currency.isBlank()) {
            throw new IllegalArgumentException("keys reply names no currency and has no denominations");
        }
        return new ExchangeKeys(currency.toUpperCase(Locale.ROOT), masterPub, denominations, auditors);
    }

    /**
     * Finds the wire fee for {@code wireMethod} whose validity interval contains {@code now}.
     */
    static Optional<Amount> wireFee(JsonNode wire, String wireMethod, Instant now) {
        JsonNode fees = wire == null ? null : wire.path("fees").get(wireMethod);
        if (fees == null || !fees.isArray()) {
            return Optional.empty();
        }
        for (JsonNode fee : fees) {
            Instant start = Timestamps.parse(fee.get("start_date"));
            Instant end = Timestamps.parse(fee.get("end_date"));
            if (!start.isAfter(now) && end.isAfter(now)) {
                return Optional.of(Amount.parse(requiredText(fee, "wire_fee")));
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the earliest, across wire methods, of the end of the last fee each method announces.
     * After that instant at least one method has no known fee.
     */
    static Optional<Instant> lastFeeEnd(JsonNode wire) {
        JsonNode fees = wire == null ? null : wire.get("fees");
        if (fees == null || !fees.isObject()) {
            return Optional.empty();
        }
        Instant earliest = null;
        Iterator<JsonNode> methods = fees.elements();
        while (methods.hasNext()) {
            Instant last = null;
            for (JsonNode fee : methods.next()) {
                Instant end = Timestamps.parse(fee.get("end_date"));
                if (last == null || end.isAfter(last)) {
                    last = end;
                }
            }
            if (last != null && (earliest == null || last.isBefore(earliest))) {
                earliest = last;
            }
        }
        return Optional.ofNullable(earliest);
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException("missing field '" + field + "'");
        }
        return value.asText();
    }
}
