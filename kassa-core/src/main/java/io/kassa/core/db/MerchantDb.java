package io.kassa.core.db;

import com.fasterxml.jackson.databind.JsonNode;
import io.kassa.core.crypto.EddsaPublicKey;
import io.kassa.core.crypto.HashCode;
import java.io.IOException;
import java.time.Instant;
import java.util.function.Consumer;

/**
 * Merchant persistence. Methods on this interface are single statements that run in autocommit
 * mode and must not be called while the calling thread holds an open {@link DbTransaction};
 * multi-statement work goes through {@link #start(String)}.
 */
public interface MerchantDb extends AutoCloseable {

    /**
     * Rolls back whatever transaction the calling thread left open. Call before {@link #start}.
     */
    void preflight();

    DbTransaction start(String label) throws IOException;

    QueryStatus insertContractTerms(String orderId, EddsaPublicKey merchantPub, Instant timestamp, JsonNode contractTerms);

    DbResult<JsonNode> findContractTerms(String orderId, EddsaPublicKey merchantPub);

    DbResult<JsonNode> findContractTermsFromHash(HashCode hContractTerms, EddsaPublicKey merchantPub);

    DbResult<JsonNode> findPaidContractTermsFromHash(HashCode hContractTerms, EddsaPublicKey merchantPub);

    DbResult<String> findSessionInfo(String sessionId, String fulfillmentUrl, EddsaPublicKey merchantPub);

    /**
     * Idempotent on {@code (h_contract_terms, merchant_pub, coin_pub)}: storing the same coin twice
     * keeps the first row and still reports {@link QueryStatus#ONE_RESULT}.
     */
    QueryStatus storeDeposit(DepositRecord deposit);

    QueryStatus findPayments(HashCode hContractTerms, EddsaPublicKey merchantPub, Consumer<DepositRecord> callback);

    QueryStatus getRefundsFromContractTermsHash(
        EddsaPublicKey merchantPub,
        HashCode hContractTerms,
        Consumer<RefundRecord> callback
    );

    QueryStatus putRefundProof(
        HashCode hContractTerms,
        EddsaPublicKey merchantPub,
        EddsaPublicKey coinPub,
        long rtransactionId,
        RefundProof proof
    );

    DbResult<RefundProof> getRefundProof(
        HashCode hContractTerms,
        EddsaPublicKey merchantPub,
        EddsaPublicKey coinPub,
        long rtransactionId
    );

    @Override
    void close();
}
