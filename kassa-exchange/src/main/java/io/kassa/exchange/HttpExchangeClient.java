package io.kassa.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kassa.core.amount.Amount;
import io.kassa.core.amount.AmountException;
import io.kassa.core.contract.Timestamps;
import io.kassa.core.crypto.EddsaPublicKey;
import io.kassa.core.crypto.RefundRequestPayload;
import io.kassa.core.exchange.DepositRequest;
import io.kassa.core.exchange.DepositResult;
import io.kassa.core.exchange.ExchangeClient;
import io.kassa.core.exchange.ExchangeHandle;
import io.kassa.core.exchange.ExchangeKeys;
import io.kassa.core.exchange.ExchangeOperation;
import io.kassa.core.exchange.FindExchangeResult;
import io.kassa.core.exchange.RefundRequest;
import io.kassa.core.exchange.RefundResult;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Talks to exchanges over HTTP. Keys and wire fees are cached per exchange until the earliest of
 * the {@code Expires} header of {@code /keys}, the end of the last wire fee any method announces,
 * and {@link #KEYS_RETRY_FREQ} after the download. A failed download is remembered for
 * {@link #KEYS_RETRY_FREQ} before it is attempted again. A lookup whose wire method has no current
 * fee in the cached copy downloads the keys once more before giving up.
 */
public final class HttpExchangeClient implements ExchangeClient {
    private static final Logger LOG = LoggerFactory.getLogger(HttpExchangeClient.class);
    private static final MediaType JSON = MediaType.get("application/json");

    public static final Duration KEYS_RETRY_FREQ = Duration.ofMinutes(60);

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Map<String, String> trusted;
    private final Clock clock;
    private final Map<String, ExchangeState> exchanges;

    public HttpExchangeClient(OkHttpClient client, ObjectMapper mapper, List<TrustedExchange> trusted, Clock clock) {
        this.client = client;
        this.mapper = mapper;
        this.clock = clock;
        this.trusted = new ConcurrentHashMap<>();
        for (TrustedExchange exchange : trusted) {
            this.trusted.put(normalize(exchange.url()), exchange.masterPublicKey() == null ? "" : exchange.masterPublicKey());
        }
        this.exchanges = new ConcurrentHashMap<>();
    }

    @Override
    public ExchangeOperation<FindExchangeResult> findExchange(String exchangeUrl, String wireMethod) {
        return lookup(exchangeUrl, wireMethod, false);
    }

    @Override
    public ExchangeOperation<FindExchangeResult> refreshExchange(String exchangeUrl, String wireMethod) {
        return lookup(exchangeUrl, wireMethod, true);
    }

    private ExchangeOperation<FindExchangeResult> lookup(String exchangeUrl, String wireMethod, boolean refresh) {
        String baseUrl = normalize(exchangeUrl);
        ExchangeState state = exchanges.computeIfAbsent(baseUrl, ExchangeState::new);
        CompletableFuture<FindExchangeResult> result = keysOf(state, refresh).thenCompose(download -> {
            FindExchangeResult found = toFindResult(state, download, wireMethod);
            if (found.errorCode() != FindExchangeResult.WIRE_FEE_UNKNOWN || download.fresh()) {
                return CompletableFuture.completedFuture(found);
            }
            LOG.info("Cached keys of exchange {} have no current fee for {}, downloading again", baseUrl, wireMethod);
            return keysOf(state, true).thenApply(again -> toFindResult(state, again, wireMethod));
        });
        return new ExchangeOperation<>(result, () -> {
        });
    }

    @Override
    public ExchangeOperation<DepositResult> deposit(ExchangeHandle handle, DepositRequest request) {
        ObjectNode body = mapper.createObjectNode();
        body.put("contribution", request.amountWithFee().toString());
        body.set("wire", request.jWire());
        body.put("h_wire", request.hWire().toBase32());
        body.put("h_contract_terms", request.hContractTerms().toBase32());
        body.put("coin_pub", request.coinPub().toBase32());
        body.put("denom_pub", request.denomPub());
        body.put("ub_sig", request.denomSig());
        body.set("timestamp", Timestamps.toJson(request.timestamp()));
        body.put("merchant_pub", request.merchantPub().toBase32());
        body.set("refund_deadline", Timestamps.toJson(request.refundDeadline()));
        body.set("wire_transfer_deadline", Timestamps.toJson(request.wireTransferDeadline()));
        body.put("coin_sig", request.coinSig());

        Call call = client.newCall(post(handle.baseUrl(), "coins/" + request.coinPub().toBase32() + "/deposit", body));
        CompletableFuture<DepositResult> result = execute(call).thenApply(reply -> {
            JsonNode json = reply.json();
            if (reply.status() == 200 && json != null) {
                return new DepositResult(200, 0, textOrNull(json, "sig"), keyOrNull(json, "pub"), json);
            }
            return new DepositResult(reply.status(), errorCode(json), null, null, json);
        });
        return new ExchangeOperation<>(result, call::cancel);
    }

    @Override
    public ExchangeOperation<RefundResult> refund(ExchangeHandle handle, RefundRequest request) {
        RefundRequestPayload payload = new RefundRequestPayload(
            request.hContractTerms(),
            request.coinPub(),
            request.merchantKeys().publicKey(),
            request.rtransactionId(),
            request.refundAmount(),
            request.refundFee()
        );
        ObjectNode body = mapper.createObjectNode();
        body.put("refund_amount", request.refundAmount().toString());
        body.put("refund_fee", request.refundFee().toString());
        body.put("h_contract_terms", request.hContractTerms().toBase32());
        body.put("rtransaction_id", request.rtransactionId());
        body.put("merchant_pub", request.merchantKeys().publicKey().toBase32());
        body.put("merchant_sig", request.merchantKeys().signBase32(payload));

        Call call = client.newCall(post(handle.baseUrl(), "coins/" + request.coinPub().toBase32() + "/refund", body));
        CompletableFuture<RefundResult> result = execute(call).thenApply(reply -> {
            JsonNode json = reply.json();
            if (reply.status() == 200 && json != null) {
                return new RefundResult(200, 0, keyOrNull(json, "pub"), textOrNull(json, "sig"), json);
            }
            return new RefundResult(reply.status(), errorCode(json), null, null, json);
        });
        return new ExchangeOperation<>(result, call::cancel);
    }

    @Override
    public void close() {
        client.dispatcher().cancelAll();
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    private CompletableFuture<KeysDownload> keysOf(ExchangeState state, boolean refresh) {
        Instant now = clock.instant();
        synchronized (state) {
            KeysDownload last = state.last;
            if (last != null && now.isBefore(state.validUntil) && !(refresh && last.keys() != null)) {
                return CompletableFuture.completedFuture(last.cached());
            }
            if (state.inflight != null) {
                return state.inflight;
            }
            LOG.info("Downloading keys of exchange {}", state.baseUrl);
            CompletableFuture<KeysDownload> download = execute(client.newCall(get(state.baseUrl, "keys")))
                .thenCompose(keysReply -> {
                    if (keysReply.status() != 200 || keysReply.json() == null) {
                        return CompletableFuture.completedFuture(KeysDownload.failure(keysReply.status(), keysReply.json()));
                    }
                    Optional<ExchangeKeys> parsed = parseKeys(state.baseUrl, keysReply.json());
                    if (parsed.isEmpty()) {
                        return CompletableFuture.completedFuture(KeysDownload.failure(keysReply.status(), keysReply.json()));
                    }
                    ExchangeKeys keys = parsed.get();
                    return execute(client.newCall(get(state.baseUrl, "wire"))).thenApply(wireReply -> {
                        if (wireReply.status() != 200 || wireReply.json() == null) {
                            return KeysDownload.failure(wireReply.status(), wireReply.json());
                        }
                        return KeysDownload.success(keys, wireReply.json(), keysReply.expires());
                    });
                })
                .thenApply(outcome -> {
                    Instant settledAt = clock.instant();
                    state.settle(outcome, outcome.keys() == null
                        ? settledAt.plus(KEYS_RETRY_FREQ)
                        : expiryOf(state, outcome, settledAt));
                    return outcome;
                });
            if (!download.isDone()) {
                state.inflight = download;
            }
            return download;
        }
    }

    private Instant expiryOf(ExchangeState state, KeysDownload download, Instant now) {
        Instant expiry = earliest(now.plus(KEYS_RETRY_FREQ), download.expires(), now);
        try {
            expiry = earliest(expiry, KeysParser.lastFeeEnd(download.wire()).orElse(null), now);
        } catch (IllegalArgumentException e) {
            LOG.warn("Exchange {} sent malformed wire fee dates: {}", state.baseUrl, e.getMessage());
        }
        LOG.debug("Keys of exchange {} are cached until {}", state.baseUrl, expiry);
        return expiry;
    }

    private static Instant earliest(Instant current, Instant candidate, Instant now) {
        if (candidate == null || !candidate.isAfter(now)) {
            return current;
        }
        return candidate.isBefore(current) ? candidate : current;
    }

    private FindExchangeResult toFindResult(ExchangeState state, KeysDownload download, String wireMethod) {
        if (download.keys() == null) {
            return FindExchangeResult.failed(FindExchangeResult.KEYS_FAILURE, download.httpStatus(), download.rawReply());
        }
        ExchangeKeys keys = download.keys();
        ExchangeHandle handle = new ExchangeHandle(state.baseUrl, keys);
        String expectedMaster = trusted.get(state.baseUrl);
        boolean isTrusted = expectedMaster != null && (expectedMaster.isBlank() || expectedMaster.equals(keys.masterPub()));
        if (wireMethod == null) {
            return FindExchangeResult.found(handle, Amount.zero(keys.currency()), isTrusted);
        }
        Optional<Amount> wireFee;
        try {
            wireFee = KeysParser.wireFee(download.wire(), wireMethod, clock.instant());
        } catch (IllegalArgumentException | AmountException e) {
            LOG.warn("Exchange {} sent malformed wire fees: {}", state.baseUrl, e.getMessage());
            return FindExchangeResult.failed(FindExchangeResult.WIRE_FEE_UNKNOWN, 200, download.wire());
        }
        if (wireFee.isEmpty()) {
            LOG.warn("Exchange {} has no current wire fee for method {}", state.baseUrl, wireMethod);
            return FindExchangeResult.failed(FindExchangeResult.WIRE_FEE_UNKNOWN, 200, download.wire());
        }
        if (!wireFee.get().currency().equals(keys.currency())) {
            return FindExchangeResult.failed(FindExchangeResult.CURRENCY_MISMATCH, 200, download.wire());
        }
        return FindExchangeResult.found(handle, wireFee.get(), isTrusted);
    }

    private static Optional<ExchangeKeys> parseKeys(String baseUrl, JsonNode json) {
        try {
            return Optional.of(KeysParser.parseKeys(json));
        } catch (IllegalArgumentException | AmountException e) {
            LOG.warn("Exchange {} sent malformed keys: {}", baseUrl, e.getMessage());
            return Optional.empty();
        }
    }

    private CompletableFuture<HttpReply> execute(Call call) {
        CompletableFuture<HttpReply> future = new CompletableFuture<>();
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failed, IOException e) {
                if (!failed.isCanceled()) {
                    LOG.warn("Request to {} failed: {}", failed.request().url(), e.getMessage());
                }
                future.complete(new HttpReply(0, null, null));
            }

            @Override
            public void onResponse(Call done, Response response) {
                try (response) {
                    String raw = response.body() == null ? "" : response.body().string();
                    Date expires = response.headers().getDate("Expires");
                    future.complete(new HttpReply(
                        response.code(),
                        parseJson(raw),
                        expires == null ? null : expires.toInstant()
                    ));
                } catch (IOException e) {
                    LOG.warn("Reading reply from {} failed: {}", done.request().url(), e.getMessage());
                    future.complete(new HttpReply(0, null, null));
                }
            }
        });
        return future;
    }

    private JsonNode parseJson(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return mapper.readTree(raw);
        } catch (IOException e) {
            LOG.debug("Exchange reply is not JSON: {}", e.getMessage());
            return null;
        }
    }

    private Request get(String baseUrl, String path) {
        return new Request.Builder().url(HttpUrl.get(baseUrl).resolve(path)).get().build();
    }

    private Request post(String baseUrl, String path, JsonNode body) {
        try {
            RequestBody requestBody = RequestBody.create(mapper.writeValueAsString(body), JSON);
            return new Request.Builder().url(HttpUrl.get(baseUrl).resolve(path)).post(requestBody).build();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize request to " + baseUrl + path, e);
        }
    }

    private static String normalize(String url) {
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed : trimmed + "/";
    }

    private static int errorCode(JsonNode json) {
        return json == null ? 0 : json.path("code").asInt(0);
    }

    private static String textOrNull(JsonNode json, String field) {
        JsonNode value = json.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static EddsaPublicKey keyOrNull(JsonNode json, String field) {
        String text = textOrNull(json, field);
        if (text == null) {
            return null;
        }
        try {
            return EddsaPublicKey.fromBase32(text);
        } catch (IllegalArgumentException e) {
            LOG.warn("Exchange sent malformed key in field {}", field);
            return null;
        }
    }

    private record HttpReply(int status, JsonNode json, Instant expires) {
    }

    private record KeysDownload(
        ExchangeKeys keys,
        JsonNode wire,
        Instant expires,
        int httpStatus,
        JsonNode rawReply,
        boolean fresh
    ) {

        static KeysDownload success(ExchangeKeys keys, JsonNode wire, Instant expires) {
            return new KeysDownload(keys, wire, expires, 200, null, true);
        }

        static KeysDownload failure(int httpStatus, JsonNode rawReply) {
            return new KeysDownload(null, null, null, httpStatus, rawReply, true);
        }

        KeysDownload cached() {
            return new KeysDownload(keys, wire, expires, httpStatus, rawReply, false);
        }
    }

    /** Last download outcome of one exchange; a failure is kept until its retry time. */
    private static final class ExchangeState {
        final String baseUrl;
        KeysDownload last;
        Instant validUntil;
        CompletableFuture<KeysDownload> inflight;

        ExchangeState(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        synchronized void settle(KeysDownload outcome, Instant until) {
            inflight = null;
            last = outcome;
            validUntil = until;
        }
    }
}
