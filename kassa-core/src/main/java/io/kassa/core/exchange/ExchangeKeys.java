package io.kassa.core.exchange;

import java.util.List;
import java.util.Optional;

public record ExchangeKeys(
    String currency,
    String masterPub,
    List<Denomination> denominations,
    List<ExchangeAuditor> auditors
) {

    public ExchangeKeys {
        denominations = List.copyOf(denominations);
        auditors = List.copyOf(auditors);
    }

    public Optional<Denomination> findDenomination(String denomPub) {
        return denominations.stream().filter(d -> d.denomPub().equals(denomPub)).findFirst();
    }
}
