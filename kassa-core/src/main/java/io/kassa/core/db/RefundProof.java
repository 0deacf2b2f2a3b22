package io.kassa.core.db;

import io.kassa.core.crypto.EddsaPublicKey;
import java.util.Objects;

public record RefundProof(EddsaPublicKey exchangePub, String exchangeSig) {

    public RefundProof {
        Objects.requireNonNull(exchangePub, "exchangePub must not be null");
        Objects.requireNonNull(exchangeSig, "exchangeSig must not be null");
    }
}
