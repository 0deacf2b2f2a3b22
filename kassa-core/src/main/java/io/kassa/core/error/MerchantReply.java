package io.kassa.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What a handler answers with. {@link #DROP} closes the connection without any reply and is
 * used when a suspended request is force-resumed during shutdown.
 */
public record MerchantReply(int status, Map<String, Object> body) {
    public static final MerchantReply DROP = new MerchantReply(-1, Map.of());

    public MerchantReply {
        Objects.requireNonNull(body, "body must not be null");
        body = Collections.unmodifiableMap(new LinkedHashMap<>(body));
    }

    public static MerchantReply ok(Map<String, Object> body) {
        return new MerchantReply(200, body);
    }

    public static MerchantReply error(ErrorCode code, String hint) {
        return error(code, code.httpStatus(), hint, Map.of());
    }

    public static MerchantReply error(ErrorCode code, String hint, Map<String, Object> details) {
        return error(code, code.httpStatus(), hint, details);
    }

    public static MerchantReply error(ErrorCode code, int status, String hint, Map<String, Object> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", code.code());
        body.put("hint", hint);
        details.forEach((key, value) -> {
            if (value != null) {
                body.put(key, value);
            }
        });
        return new MerchantReply(status, body);
    }

    public boolean isDrop() {
        return this == DROP;
    }

    public boolean isSuccess() {
        return status == 200;
    }
}
