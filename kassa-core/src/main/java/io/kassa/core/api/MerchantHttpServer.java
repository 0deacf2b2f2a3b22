package io.kassa.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.kassa.core.error.ErrorCode;
import io.kassa.core.error.MerchantException;
import io.kassa.core.error.MerchantReply;
import io.kassa.core.instance.MerchantInstance;
import io.kassa.core.poll.PollRequest;
import io.kassa.core.uri.RequestOrigin;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP front of the merchant backend. Paths may carry an {@code /instances/<id>} prefix to select
 * a non-default instance. Requests whose reply is computed asynchronously keep their exchange
 * open until the reply future completes.
 */
public final class MerchantHttpServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(MerchantHttpServer.class);
    private static final String INSTANCES_PREFIX = "/instances/";

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final MerchantBackend backend;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public MerchantHttpServer(int port, String host, MerchantBackend backend) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.backend = backend;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }
        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(this::route)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Merchant backend listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    /**
     * Cooperative shutdown: every suspended pay request, refund lookup and long-poll waiter is
     * resumed and its connection dropped before the listener stops.
     */
    @Override
    public void close() {
        if (!running.getAndSet(false)) {
            return;
        }
        LOG.info("Shutting down merchant backend");
        backend.pay().forceResumeAll();
        backend.refundLookup().forceResumeAll();
        backend.hub().shutdown();
        if (server != null) {
            server.stop();
        }
    }

    private void route(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    route(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }
        String path = exchange.getRequestPath();
        String instanceId = MerchantInstance.DEFAULT_ID;
        if (path.startsWith(INSTANCES_PREFIX)) {
            String rest = path.substring(INSTANCES_PREFIX.length());
            int slash = rest.indexOf('/');
            if (slash <= 0) {
                sendReply(exchange, MerchantReply.error(ErrorCode.ENDPOINT_UNKNOWN, "no endpoint given"));
                return;
            }
            instanceId = rest.substring(0, slash);
            path = rest.substring(slash);
        }
        String method = exchange.getRequestMethod().toString();
        switch (path) {
            case "/healthz":
                if (requireMethod(exchange, method, "GET")) {
                    sendJson(exchange, 200, Map.of("status", "ok"));
                }
                return;
            case "/pay":
                if (requireMethod(exchange, method, "POST")) {
                    handlePay(exchange, instanceId);
                }
                return;
            case "/refund":
                if ("POST".equalsIgnoreCase(method)) {
                    handleRefundIncrease(exchange, instanceId);
                } else if (requireMethod(exchange, method, "GET")) {
                    handleRefundLookup(exchange, instanceId);
                }
                return;
            case "/poll-payment":
                if (requireMethod(exchange, method, "GET")) {
                    handlePollPayment(exchange, instanceId);
                }
                return;
            default:
                sendReply(exchange, MerchantReply.error(ErrorCode.ENDPOINT_UNKNOWN, "unknown endpoint " + path));
        }
    }

    private void handlePay(HttpServerExchange exchange, String instanceId) throws IOException {
        Optional<MerchantInstance> instance = resolveInstance(exchange, instanceId);
        if (instance.isEmpty()) {
            return;
        }
        Optional<JsonNode> body = readJsonBody(exchange);
        if (body.isEmpty()) {
            return;
        }
        replyWhenDone(exchange, backend.pay().pay(instance.get(), body.get()));
    }

    private void handleRefundIncrease(HttpServerExchange exchange, String instanceId) throws IOException {
        Optional<MerchantInstance> instance = resolveInstance(exchange, instanceId);
        if (instance.isEmpty()) {
            return;
        }
        Optional<JsonNode> body = readJsonBody(exchange);
        if (body.isEmpty()) {
            return;
        }
        MerchantInstance resolved = instance.get().retain();
        try {
            sendReply(exchange, backend.refundIncrease().increase(resolved, body.get(), origin(exchange)));
        } finally {
            resolved.release();
        }
    }

    private void handleRefundLookup(HttpServerExchange exchange, String instanceId) throws IOException {
        Optional<MerchantInstance> instance = resolveInstance(exchange, instanceId);
        if (instance.isEmpty()) {
            return;
        }
        replyWhenDone(exchange, backend.refundLookup().lookup(instance.get(), queryParam(exchange, "order_id")));
    }

    private void handlePollPayment(HttpServerExchange exchange, String instanceId) throws IOException {
        Optional<MerchantInstance> instance = resolveInstance(exchange, instanceId);
        if (instance.isEmpty()) {
            return;
        }
        PollRequest request;
        try {
            request = PollRequest.fromQuery(queryParams(exchange), origin(exchange));
        } catch (MerchantException e) {
            sendReply(exchange, e.reply());
            return;
        }
        replyWhenDone(exchange, backend.pollPayment().poll(instance.get(), request));
    }

    private Optional<MerchantInstance> resolveInstance(HttpServerExchange exchange, String instanceId) throws IOException {
        Optional<MerchantInstance> instance = backend.instances().lookup(instanceId);
        if (instance.isEmpty()) {
            sendReply(exchange, MerchantReply.error(
                ErrorCode.INSTANCE_UNKNOWN,
                "unknown instance",
                Map.of("instance", instanceId)
            ));
        }
        return instance;
    }

    private boolean requireMethod(HttpServerExchange exchange, String method, String expected) throws IOException {
        if (expected.equalsIgnoreCase(method)) {
            return true;
        }
        sendReply(exchange, MerchantReply.error(ErrorCode.METHOD_NOT_ALLOWED, "method " + method + " not allowed"));
        return false;
    }

    private void replyWhenDone(HttpServerExchange exchange, CompletableFuture<MerchantReply> reply) {
        reply.whenComplete((result, error) -> {
            if (error != null) {
                sendInternalError(exchange, error);
                return;
            }
            try {
                sendReply(exchange, result);
            } catch (IOException e) {
                LOG.warn("Failed to send reply to {}", exchange.getSourceAddress(), e);
            }
        });
    }

    private void sendReply(HttpServerExchange exchange, MerchantReply reply) throws IOException {
        if (reply.isDrop()) {
            LOG.debug("Dropping connection from {}", exchange.getSourceAddress());
            exchange.getConnection().close();
            return;
        }
        sendJson(exchange, reply.status(), reply.body());
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    /**
     * Empty when the body was not JSON; a 400 reply has then been sent already.
     */
    private Optional<JsonNode> readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        try {
            JsonNode body = bytes.length == 0 ? null : mapper.readTree(bytes);
            if (body == null || !body.isObject()) {
                sendReply(exchange, MerchantReply.error(ErrorCode.JSON_INVALID, "request body must be a JSON object"));
                return Optional.empty();
            }
            return Optional.of(body);
        } catch (JsonProcessingException e) {
            sendReply(exchange, MerchantReply.error(ErrorCode.JSON_INVALID, "malformed JSON in request body"));
            return Optional.empty();
        }
    }

    private RequestOrigin origin(HttpServerExchange exchange) {
        boolean https = "https".equalsIgnoreCase(exchange.getRequestScheme())
            || "https".equalsIgnoreCase(header(exchange, "X-Forwarded-Proto"));
        String hostHeader = header(exchange, "Host");
        return new RequestOrigin(
            hostHeader.isEmpty() ? exchange.getHostAndPort() : hostHeader,
            header(exchange, "X-Forwarded-Host"),
            header(exchange, "X-Forwarded-Prefix"),
            https
        );
    }

    private Map<String, String> queryParams(HttpServerExchange exchange) {
        Map<String, String> params = new LinkedHashMap<>();
        for (Map.Entry<String, Deque<String>> entry : exchange.getQueryParameters().entrySet()) {
            String value = entry.getValue().peekFirst();
            if (value != null) {
                params.put(entry.getKey(), value);
            }
        }
        return params;
    }

    private String queryParam(HttpServerExchange exchange, String key) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        return values == null ? null : values.peekFirst();
    }

    private String header(HttpServerExchange exchange, String name) {
        String value = exchange.getRequestHeaders().getFirst(name);
        return value == null ? "" : value;
    }

    private void sendInternalError(HttpServerExchange exchange, Throwable error) {
        LOG.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), error);
        try {
            sendReply(exchange, MerchantReply.error(ErrorCode.INTERNAL_INVARIANT_FAILURE, "internal error"));
        } catch (IOException e) {
            LOG.warn("Failed to send error reply", e);
        }
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        for (Undertow.ListenerInfo listener : undertow.getListenerInfo()) {
            if (listener.getAddress() instanceof InetSocketAddress socketAddress) {
                return socketAddress.getPort();
            }
        }
        return fallbackPort;
    }
}
