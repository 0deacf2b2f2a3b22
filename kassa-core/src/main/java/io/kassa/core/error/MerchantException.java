package io.kassa.core.error;

/**
 * Thrown while validating a request when the request has to be answered with {@link #reply()}.
 */
public final class MerchantException extends Exception {
    private final transient MerchantReply reply;

    public MerchantException(MerchantReply reply) {
        super(String.valueOf(reply.body().get("hint")));
        this.reply = reply;
    }

    public MerchantException(ErrorCode code, String hint) {
        this(MerchantReply.error(code, hint));
    }

    public MerchantReply reply() {
        return reply;
    }
}
