package io.kassa.core.exchange;

import io.kassa.core.error.ErrorCode;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a denomination may be accepted. Expired denominations are refused even from a
 * trusted exchange; otherwise a trusted exchange is enough unless {@code forceAudit} is set, and
 * everything else needs one of the configured auditors to vouch for the denomination.
 */
public final class AuditorPolicy {
    private final Set<String> auditorPubs;
    private final boolean forceAudit;
    private final Clock clock;

    public AuditorPolicy(List<String> auditorPubs, boolean forceAudit, Clock clock) {
        this.auditorPubs = Set.copyOf(auditorPubs);
        this.forceAudit = forceAudit;
        this.clock = clock;
    }

    public Optional<ErrorCode> check(ExchangeKeys keys, Denomination denomination, boolean trustedExchange) {
        if (!denomination.expireDeposit().isAfter(clock.instant())) {
            return Optional.of(ErrorCode.PAY_DENOMINATION_DEPOSIT_EXPIRED);
        }
        if (trustedExchange && !forceAudit) {
            return Optional.empty();
        }
        boolean audited = keys.auditors().stream()
            .filter(auditor -> auditorPubs.contains(auditor.auditorPub()))
            .anyMatch(auditor -> auditor.denomPubs().contains(denomination.denomPub()));
        return audited ? Optional.empty() : Optional.of(ErrorCode.PAY_DENOMINATION_KEY_AUDITOR_FAILURE);
    }

    public boolean forceAudit() {
        return forceAudit;
    }
}
