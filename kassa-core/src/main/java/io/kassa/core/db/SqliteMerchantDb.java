package io.kassa.core.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kassa.core.amount.Amount;
import io.kassa.core.contract.CanonicalJson;
import io.kassa.core.crypto.EddsaPublicKey;
import io.kassa.core.crypto.HashCode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SQLite store. Every autocommit call and every transaction uses its own connection, so
 * concurrent writers surface as {@code SQLITE_BUSY} which is reported as a soft error.
 */
public final class SqliteMerchantDb implements MerchantDb {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteMerchantDb.class);
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;
    private static final String[] TABLES = {
        "merchant_session_info",
        "merchant_refund_proofs",
        "merchant_refunds",
        "merchant_deposits",
        "merchant_contract_terms"
    };

    private final String jdbcUrl;
    private final ObjectMapper mapper;
    private final ThreadLocal<SqliteTransaction> openTransaction;

    public SqliteMerchantDb(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Path parent = dbPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.mapper = new ObjectMapper();
        this.openTransaction = new ThreadLocal<>();
        initialize();
    }

    /**
     * Drops every table. Used by {@code dbinit --reset}.
     */
    public void reset() throws IOException {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            for (String table : TABLES) {
                statement.execute("DROP TABLE IF EXISTS " + table);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to drop merchant tables", e);
        }
        initialize();
    }

    @Override
    public void preflight() {
        SqliteTransaction leftover = openTransaction.get();
        if (leftover != null && leftover.isOpen()) {
            LOG.warn("Rolling back leftover transaction '{}'", leftover.label());
            leftover.rollback();
        }
        openTransaction.remove();
    }

    @Override
    public DbTransaction start(String label) throws IOException {
        Objects.requireNonNull(label, "label must not be null");
        try {
            Connection connection = openConnection();
            connection.setAutoCommit(false);
            SqliteTransaction transaction = new SqliteTransaction(label, connection);
            openTransaction.set(transaction);
            LOG.debug("Started transaction '{}'", label);
            return transaction;
        } catch (SQLException e) {
            throw new IOException("Failed to start transaction " + label, e);
        }
    }

    @Override
    public QueryStatus insertContractTerms(
        String orderId,
        EddsaPublicKey merchantPub,
        Instant timestamp,
        JsonNode contractTerms
    ) {
        String sql = """
            INSERT INTO merchant_contract_terms
              (order_id, merchant_pub, contract_terms, h_contract_terms, timestamp, paid)
            VALUES (?, ?, ?, ?, ?, 0)
            ON CONFLICT DO NOTHING
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, orderId);
            statement.setString(2, merchantPub.toBase32());
            statement.setString(3, mapper.writeValueAsString(contractTerms));
            statement.setString(4, CanonicalJson.hash(contractTerms).toBase32());
            statement.setLong(5, timestamp.getEpochSecond());
            return statement.executeUpdate() == 1 ? QueryStatus.ONE_RESULT : QueryStatus.NO_RESULTS;
        } catch (SQLException e) {
            return classify("insert_contract_terms", e);
        } catch (JsonProcessingException e) {
            LOG.error("Cannot serialize contract terms of order {}", orderId, e);
            return QueryStatus.HARD_ERROR;
        }
    }

    @Override
    public DbResult<JsonNode> findContractTerms(String orderId, EddsaPublicKey merchantPub) {
        String sql = """
            SELECT contract_terms FROM merchant_contract_terms
            WHERE order_id = ? AND merchant_pub = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, orderId);
            statement.setString(2, merchantPub.toBase32());
            return singleJson(statement);
        } catch (SQLException e) {
            return DbResult.error(classify("find_contract_terms", e));
        }
    }

    @Override
    public DbResult<JsonNode> findContractTermsFromHash(HashCode hContractTerms, EddsaPublicKey merchantPub) {
        try (Connection connection = openConnection()) {
            return contractTermsByHash(connection, hContractTerms, merchantPub, false);
        } catch (SQLException e) {
            return DbResult.error(classify("find_contract_terms_from_hash", e));
        }
    }

    @Override
    public DbResult<JsonNode> findPaidContractTermsFromHash(HashCode hContractTerms, EddsaPublicKey merchantPub) {
        try (Connection connection = openConnection()) {
            return contractTermsByHash(connection, hContractTerms, merchantPub, true);
        } catch (SQLException e) {
            return DbResult.error(classify("find_paid_contract_terms_from_hash", e));
        }
    }

    @Override
    public DbResult<String> findSessionInfo(String sessionId, String fulfillmentUrl, EddsaPublicKey merchantPub) {
        String sql = """
            SELECT order_id FROM merchant_session_info
            WHERE session_id = ? AND fulfillment_url = ? AND merchant_pub = ?
            ORDER BY timestamp DESC
            LIMIT 1
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, sessionId);
            statement.setString(2, fulfillmentUrl);
            statement.setString(3, merchantPub.toBase32());
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? DbResult.found(resultSet.getString("order_id")) : DbResult.notFound();
            }
        } catch (SQLException e) {
            return DbResult.error(classify("find_session_info", e));
        }
    }

    @Override
    public QueryStatus storeDeposit(DepositRecord deposit) {
        String sql = """
            INSERT INTO merchant_deposits
              (h_contract_terms, merchant_pub, coin_pub, exchange_url, amount_with_fee,
               deposit_fee, refund_fee, wire_fee, signkey_pub, exchange_proof)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (h_contract_terms, merchant_pub, coin_pub) DO NOTHING
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, deposit.hContractTerms().toBase32());
            statement.setString(2, deposit.merchantPub().toBase32());
            statement.setString(3, deposit.coinPub().toBase32());
            statement.setString(4, deposit.exchangeUrl());
            statement.setString(5, deposit.amountWithFee().toString());
            statement.setString(6, deposit.depositFee().toString());
            statement.setString(7, deposit.refundFee().toString());
            statement.setString(8, deposit.wireFee().toString());
            statement.setString(9, deposit.exchangeSigningPub() == null ? null : deposit.exchangeSigningPub().toBase32());
            statement.setString(10, deposit.exchangeProof() == null ? null : mapper.writeValueAsString(deposit.exchangeProof()));
            if (statement.executeUpdate() == 0) {
                LOG.debug("Deposit of coin {} for {} already stored", deposit.coinPub(), deposit.hContractTerms());
            }
            return QueryStatus.ONE_RESULT;
        } catch (SQLException e) {
            return classify("store_deposit", e);
        } catch (JsonProcessingException e) {
            LOG.error("Cannot serialize exchange proof for coin {}", deposit.coinPub(), e);
            return QueryStatus.HARD_ERROR;
        }
    }

    @Override
    public QueryStatus findPayments(HashCode hContractTerms, EddsaPublicKey merchantPub, Consumer<DepositRecord> callback) {
        try (Connection connection = openConnection()) {
            return forEachDeposit(connection, hContractTerms, merchantPub, callback);
        } catch (SQLException e) {
            return classify("find_payments", e);
        }
    }

    @Override
    public QueryStatus getRefundsFromContractTermsHash(
        EddsaPublicKey merchantPub,
        HashCode hContractTerms,
        Consumer<RefundRecord> callback
    ) {
        try (Connection connection = openConnection()) {
            return forEachRefund(connection, merchantPub, hContractTerms, callback);
        } catch (SQLException e) {
            return classify("get_refunds_from_contract_terms_hash", e);
        }
    }

    @Override
    public QueryStatus putRefundProof(
        HashCode hContractTerms,
        EddsaPublicKey merchantPub,
        EddsaPublicKey coinPub,
        long rtransactionId,
        RefundProof proof
    ) {
        String sql = """
            INSERT INTO merchant_refund_proofs
              (h_contract_terms, merchant_pub, coin_pub, rtransaction_id, exchange_pub, exchange_sig)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT DO NOTHING
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, hContractTerms.toBase32());
            statement.setString(2, merchantPub.toBase32());
            statement.setString(3, coinPub.toBase32());
            statement.setLong(4, rtransactionId);
            statement.setString(5, proof.exchangePub().toBase32());
            statement.setString(6, proof.exchangeSig());
            return statement.executeUpdate() == 1 ? QueryStatus.ONE_RESULT : QueryStatus.NO_RESULTS;
        } catch (SQLException e) {
            return classify("put_refund_proof", e);
        }
    }

    @Override
    public DbResult<RefundProof> getRefundProof(
        HashCode hContractTerms,
        EddsaPublicKey merchantPub,
        EddsaPublicKey coinPub,
        long rtransactionId
    ) {
        String sql = """
            SELECT exchange_pub, exchange_sig FROM merchant_refund_proofs
            WHERE h_contract_terms = ? AND merchant_pub = ? AND coin_pub = ? AND rtransaction_id = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, hContractTerms.toBase32());
            statement.setString(2, merchantPub.toBase32());
            statement.setString(3, coinPub.toBase32());
            statement.setLong(4, rtransactionId);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return DbResult.notFound();
                }
                return DbResult.found(new RefundProof(
                    EddsaPublicKey.fromBase32(resultSet.getString("exchange_pub")),
                    resultSet.getString("exchange_sig")
                ));
            }
        } catch (SQLException e) {
            return DbResult.error(classify("get_refund_proof", e));
        }
    }

    @Override
    public void close() {
        preflight();
    }

    private DbResult<JsonNode> contractTermsByHash(
        Connection connection,
        HashCode hContractTerms,
        EddsaPublicKey merchantPub,
        boolean paidOnly
    ) throws SQLException {
        String sql = """
            SELECT contract_terms FROM merchant_contract_terms
            WHERE h_contract_terms = ? AND merchant_pub = ?
            """ + (paidOnly ? " AND paid = 1" : "");
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, hContractTerms.toBase32());
            statement.setString(2, merchantPub.toBase32());
            return singleJson(statement);
        }
    }

    private DbResult<JsonNode> singleJson(PreparedStatement statement) throws SQLException {
        try (ResultSet resultSet = statement.executeQuery()) {
            if (!resultSet.next()) {
                return DbResult.notFound();
            }
            return DbResult.found(readJson(resultSet.getString(1)));
        }
    }

    private QueryStatus forEachDeposit(
        Connection connection,
        HashCode hContractTerms,
        EddsaPublicKey merchantPub,
        Consumer<DepositRecord> callback
    ) throws SQLException {
        String sql = """
            SELECT coin_pub, exchange_url, amount_with_fee, deposit_fee, refund_fee, wire_fee,
                   signkey_pub, exchange_proof
            FROM merchant_deposits
            WHERE h_contract_terms = ? AND merchant_pub = ?
            ORDER BY rowid ASC
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, hContractTerms.toBase32());
            statement.setString(2, merchantPub.toBase32());
            int rows = 0;
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    String signkey = resultSet.getString("signkey_pub");
                    String proof = resultSet.getString("exchange_proof");
                    callback.accept(new DepositRecord(
                        hContractTerms,
                        merchantPub,
                        EddsaPublicKey.fromBase32(resultSet.getString("coin_pub")),
                        resultSet.getString("exchange_url"),
                        Amount.parse(resultSet.getString("amount_with_fee")),
                        Amount.parse(resultSet.getString("deposit_fee")),
                        Amount.parse(resultSet.getString("refund_fee")),
                        Amount.parse(resultSet.getString("wire_fee")),
                        signkey == null ? null : EddsaPublicKey.fromBase32(signkey),
                        proof == null ? null : readJson(proof)
                    ));
                    rows++;
                }
            }
            return rows == 0 ? QueryStatus.NO_RESULTS : QueryStatus.ONE_RESULT;
        }
    }

    private QueryStatus forEachRefund(
        Connection connection,
        EddsaPublicKey merchantPub,
        HashCode hContractTerms,
        Consumer<RefundRecord> callback
    ) throws SQLException {
        String sql = """
            SELECT r.coin_pub, d.exchange_url, r.rtransaction_id, r.reason, r.refund_amount, r.refund_fee
            FROM merchant_refunds r
            JOIN merchant_deposits d
              ON d.h_contract_terms = r.h_contract_terms
             AND d.merchant_pub = r.merchant_pub
             AND d.coin_pub = r.coin_pub
            WHERE r.merchant_pub = ? AND r.h_contract_terms = ?
            ORDER BY r.rowid ASC
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, merchantPub.toBase32());
            statement.setString(2, hContractTerms.toBase32());
            int rows = 0;
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    callback.accept(new RefundRecord(
                        hContractTerms,
                        merchantPub,
                        EddsaPublicKey.fromBase32(resultSet.getString("coin_pub")),
                        resultSet.getString("exchange_url"),
                        resultSet.getLong("rtransaction_id"),
                        resultSet.getString("reason"),
                        Amount.parse(resultSet.getString("refund_amount")),
                        Amount.parse(resultSet.getString("refund_fee"))
                    ));
                    rows++;
                }
            }
            return rows == 0 ? QueryStatus.NO_RESULTS : QueryStatus.ONE_RESULT;
        }
    }

    private JsonNode readJson(String raw) throws SQLException {
        try {
            return mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new SQLException("Stored JSON is corrupt", e);
        }
    }

    private QueryStatus classify(String operation, SQLException e) {
        int primary = e.getErrorCode() & 0xFF;
        if (primary == SQLITE_BUSY || primary == SQLITE_LOCKED) {
            LOG.warn("Serialization failure in {}: {}", operation, e.getMessage());
            return QueryStatus.SOFT_ERROR;
        }
        LOG.error("Database failure in {}", operation, e);
        return QueryStatus.HARD_ERROR;
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
            statement.execute("PRAGMA busy_timeout=2000;");
        }
        return connection;
    }

    private void initialize() throws IOException {
        String contracts = """
            CREATE TABLE IF NOT EXISTS merchant_contract_terms (
                order_id TEXT NOT NULL,
                merchant_pub TEXT NOT NULL,
                contract_terms TEXT NOT NULL,
                h_contract_terms TEXT NOT NULL,
                timestamp INTEGER NOT NULL,
                paid INTEGER NOT NULL DEFAULT 0,
                PRIMARY KEY (order_id, merchant_pub),
                UNIQUE (h_contract_terms, merchant_pub)
            )
            """;
        String deposits = """
            CREATE TABLE IF NOT EXISTS merchant_deposits (
                h_contract_terms TEXT NOT NULL,
                merchant_pub TEXT NOT NULL,
                coin_pub TEXT NOT NULL,
                exchange_url TEXT NOT NULL,
                amount_with_fee TEXT NOT NULL,
                deposit_fee TEXT NOT NULL,
                refund_fee TEXT NOT NULL,
                wire_fee TEXT NOT NULL,
                signkey_pub TEXT,
                exchange_proof TEXT,
                PRIMARY KEY (h_contract_terms, merchant_pub, coin_pub)
            )
            """;
        String refunds = """
            CREATE TABLE IF NOT EXISTS merchant_refunds (
                merchant_pub TEXT NOT NULL,
                h_contract_terms TEXT NOT NULL,
                coin_pub TEXT NOT NULL,
                rtransaction_id INTEGER NOT NULL,
                reason TEXT NOT NULL,
                refund_amount TEXT NOT NULL,
                refund_fee TEXT NOT NULL,
                UNIQUE (merchant_pub, h_contract_terms, coin_pub, rtransaction_id)
            )
            """;
        String proofs = """
            CREATE TABLE IF NOT EXISTS merchant_refund_proofs (
                h_contract_terms TEXT NOT NULL,
                merchant_pub TEXT NOT NULL,
                coin_pub TEXT NOT NULL,
                rtransaction_id INTEGER NOT NULL,
                exchange_pub TEXT NOT NULL,
                exchange_sig TEXT NOT NULL,
                PRIMARY KEY (h_contract_terms, merchant_pub, coin_pub, rtransaction_id)
            )
            """;
        String sessions = """
            CREATE TABLE IF NOT EXISTS merchant_session_info (
                session_id TEXT NOT NULL,
                fulfillment_url TEXT NOT NULL,
                order_id TEXT NOT NULL,
                merchant_pub TEXT NOT NULL,
                timestamp INTEGER NOT NULL,
                PRIMARY KEY (session_id, fulfillment_url, merchant_pub)
            )
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(contracts);
            statement.execute(deposits);
            statement.execute(refunds);
            statement.execute(proofs);
            statement.execute(sessions);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite merchant database", e);
        }
    }

    private final class SqliteTransaction implements DbTransaction {
        private final String label;
        private final Connection connection;
        private boolean open;

        private SqliteTransaction(String label, Connection connection) {
            this.label = label;
            this.connection = connection;
            this.open = true;
        }

        @Override
        public String label() {
            return label;
        }

        @Override
        public QueryStatus findPayments(
            HashCode hContractTerms,
            EddsaPublicKey merchantPub,
            Consumer<DepositRecord> callback
        ) {
            try {
                return forEachDeposit(requireOpen(), hContractTerms, merchantPub, callback);
            } catch (SQLException e) {
                return classify(label + ":find_payments", e);
            }
        }

        @Override
        public QueryStatus getRefundsFromContractTermsHash(
            EddsaPublicKey merchantPub,
            HashCode hContractTerms,
            Consumer<RefundRecord> callback
        ) {
            try {
                return forEachRefund(requireOpen(), merchantPub, hContractTerms, callback);
            } catch (SQLException e) {
                return classify(label + ":get_refunds_from_contract_terms_hash", e);
            }
        }

        @Override
        public DbResult<JsonNode> findPaidContractTermsFromHash(HashCode hContractTerms, EddsaPublicKey merchantPub) {
            try {
                return contractTermsByHash(requireOpen(), hContractTerms, merchantPub, true);
            } catch (SQLException e) {
                return DbResult.error(classify(label + ":find_paid_contract_terms_from_hash", e));
            }
        }

        @Override
        public QueryStatus markProposalPaid(HashCode hContractTerms, EddsaPublicKey merchantPub) {
            String sql = """
                UPDATE merchant_contract_terms SET paid = 1
                WHERE h_contract_terms = ? AND merchant_pub = ?
                """;
            try (PreparedStatement statement = requireOpen().prepareStatement(sql)) {
                statement.setString(1, hContractTerms.toBase32());
                statement.setString(2, merchantPub.toBase32());
                return statement.executeUpdate() == 1 ? QueryStatus.ONE_RESULT : QueryStatus.NO_RESULTS;
            } catch (SQLException e) {
                return classify(label + ":mark_proposal_paid", e);
            }
        }

        @Override
        public QueryStatus insertSessionInfo(
            String sessionId,
            String fulfillmentUrl,
            String orderId,
            EddsaPublicKey merchantPub
        ) {
            String sql = """
                INSERT INTO merchant_session_info (session_id, fulfillment_url, order_id, merchant_pub, timestamp)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT (session_id, fulfillment_url, merchant_pub)
                DO UPDATE SET order_id = excluded.order_id, timestamp = excluded.timestamp
                """;
            try (PreparedStatement statement = requireOpen().prepareStatement(sql)) {
                statement.setString(1, sessionId);
                statement.setString(2, fulfillmentUrl);
                statement.setString(3, orderId);
                statement.setString(4, merchantPub.toBase32());
                statement.setLong(5, Instant.now().toEpochMilli());
                statement.executeUpdate();
                return QueryStatus.ONE_RESULT;
            } catch (SQLException e) {
                return classify(label + ":insert_session_info", e);
            }
        }

        @Override
        public QueryStatus increaseRefundForContract(
            HashCode hContractTerms,
            EddsaPublicKey merchantPub,
            Amount refund,
            String reason
        ) {
            try {
                Connection connection = requireOpen();
                Map<EddsaPublicKey, CoinRefundState> coins = new LinkedHashMap<>();
                forEachDeposit(connection, hContractTerms, merchantPub, deposit -> coins.put(
                    deposit.coinPub(),
                    new CoinRefundState(deposit.coinPub(), deposit.amountWithFee(), deposit.refundFee())
                ));
                Amount totalPaid = Amount.zero(refund.currency());
                for (CoinRefundState coin : coins.values()) {
                    totalPaid = totalPaid.add(coin.amountWithFee);
                }
                Amount previous = Amount.zero(refund.currency());
                List<RefundRecord> existing = new ArrayList<>();
                forEachRefund(connection, merchantPub, hContractTerms, existing::add);
                for (RefundRecord record : existing) {
                    CoinRefundState coin = coins.get(record.coinPub());
                    coin.refunded = coin.refunded.add(record.refundAmount());
                    coin.nextTransactionId = Math.max(coin.nextTransactionId, record.rtransactionId() + 1);
                    previous = previous.add(record.refundAmount());
                }
                if (previous.atLeast(refund)) {
                    LOG.debug("Refund ceiling {} already covers {}", previous, refund);
                    return QueryStatus.ONE_RESULT;
                }
                if (refund.greaterThan(totalPaid)) {
                    LOG.info("Refund {} exceeds total paid {} for {}", refund, totalPaid, hContractTerms);
                    return QueryStatus.NO_RESULTS;
                }
                Amount remaining = refund.subtractOrZero(previous);
                for (CoinRefundState coin : coins.values()) {
                    if (remaining.isZero()) {
                        break;
                    }
                    Amount room = coin.amountWithFee.subtractOrZero(coin.refunded);
                    if (room.isZero()) {
                        continue;
                    }
                    Amount increment = room.atLeast(remaining) ? remaining : room;
                    insertRefund(connection, hContractTerms, merchantPub, coin, reason, increment);
                    remaining = remaining.subtractOrZero(increment);
                }
                return QueryStatus.ONE_RESULT;
            } catch (SQLException e) {
                return classify(label + ":increase_refund_for_contract", e);
            }
        }

        @Override
        public QueryStatus commit() {
            try {
                requireOpen().commit();
                LOG.debug("Committed transaction '{}'", label);
                return QueryStatus.NO_RESULTS;
            } catch (SQLException e) {
                QueryStatus status = classify(label + ":commit", e);
                rollback();
                return status;
            } finally {
                finish();
            }
        }

        @Override
        public void rollback() {
            if (!open) {
                return;
            }
            try {
                connection.rollback();
            } catch (SQLException e) {
                LOG.warn("Rollback of '{}' failed: {}", label, e.getMessage());
            } finally {
                finish();
            }
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            rollback();
        }

        private void insertRefund(
            Connection connection,
            HashCode hContractTerms,
            EddsaPublicKey merchantPub,
            CoinRefundState coin,
            String reason,
            Amount increment
        ) throws SQLException {
            String sql = """
                INSERT INTO merchant_refunds
                  (merchant_pub, h_contract_terms, coin_pub, rtransaction_id, reason, refund_amount, refund_fee)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """;
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, merchantPub.toBase32());
                statement.setString(2, hContractTerms.toBase32());
                statement.setString(3, coin.coinPub.toBase32());
                statement.setLong(4, coin.nextTransactionId);
                statement.setString(5, reason == null ? "" : reason);
                statement.setString(6, increment.toString());
                statement.setString(7, coin.refundFee.toString());
                statement.executeUpdate();
            }
            coin.refunded = coin.refunded.add(increment);
            coin.nextTransactionId++;
        }

        private Connection requireOpen() throws SQLException {
            if (!open) {
                throw new SQLException("transaction '" + label + "' is no longer open");
            }
            return connection;
        }

        private void finish() {
            open = false;
            if (openTransaction.get() == this) {
                openTransaction.remove();
            }
            try {
                connection.close();
            } catch (SQLException e) {
                LOG.warn("Closing connection of '{}' failed: {}", label, e.getMessage());
            }
        }
    }

    private static final class CoinRefundState {
        private final EddsaPublicKey coinPub;
        private final Amount amountWithFee;
        private final Amount refundFee;
        private Amount refunded;
        private long nextTransactionId;

        private CoinRefundState(EddsaPublicKey coinPub, Amount amountWithFee, Amount refundFee) {
            this.coinPub = coinPub;
            this.amountWithFee = amountWithFee;
            this.refundFee = refundFee;
            this.refunded = Amount.zero(amountWithFee.currency());
            this.nextTransactionId = 0;
        }
    }
}
