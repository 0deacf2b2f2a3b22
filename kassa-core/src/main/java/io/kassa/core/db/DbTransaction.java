package io.kassa.core.db;

import com.fasterxml.jackson.databind.JsonNode;
import io.kassa.core.amount.Amount;
import io.kassa.core.crypto.EddsaPublicKey;
import io.kassa.core.crypto.HashCode;
import java.util.function.Consumer;

/**
 * Serializable transaction owned by the caller. Any {@link QueryStatus#SOFT_ERROR} means the
 * caller must {@link #rollback()} and start over.
 */
public interface DbTransaction extends AutoCloseable {

    String label();

    QueryStatus findPayments(HashCode hContractTerms, EddsaPublicKey merchantPub, Consumer<DepositRecord> callback);

    QueryStatus getRefundsFromContractTermsHash(
        EddsaPublicKey merchantPub,
        HashCode hContractTerms,
        Consumer<RefundRecord> callback
    );

    DbResult<JsonNode> findPaidContractTermsFromHash(HashCode hContractTerms, EddsaPublicKey merchantPub);

    QueryStatus markProposalPaid(HashCode hContractTerms, EddsaPublicKey merchantPub);

    QueryStatus insertSessionInfo(String sessionId, String fulfillmentUrl, String orderId, EddsaPublicKey merchantPub);

    /**
     * Raises the refund ceiling of an order to {@code refund}. Returns {@link QueryStatus#NO_RESULTS}
     * when that exceeds what was paid, {@link QueryStatus#ONE_RESULT} when the ceiling now covers it.
     */
    QueryStatus increaseRefundForContract(
        HashCode hContractTerms,
        EddsaPublicKey merchantPub,
        Amount refund,
        String reason
    );

    QueryStatus commit();

    void rollback();

    boolean isOpen();

    /**
     * Rolls back if neither committed nor rolled back yet.
     */
    @Override
    void close();
}
