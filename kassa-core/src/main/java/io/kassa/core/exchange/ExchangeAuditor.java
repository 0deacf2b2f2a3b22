package io.kassa.core.exchange;

import java.util.Set;

/**
 * An auditor as announced in an exchange's keys, with the denominations it vouches for.
 */
public record ExchangeAuditor(String auditorPub, String auditorUrl, Set<String> denomPubs) {

    public ExchangeAuditor {
        denomPubs = Set.copyOf(denomPubs);
    }
}
