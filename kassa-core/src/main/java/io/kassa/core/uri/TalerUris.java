package io.kassa.core.uri;

import io.kassa.core.instance.MerchantInstance;

public final class TalerUris {

    private TalerUris() {
    }

    public static String refundUri(RequestOrigin origin, MerchantInstance instance, String orderId) {
        return "taler://refund/" + base(origin, instance, orderId) + insecure(origin);
    }

    public static String payUri(RequestOrigin origin, MerchantInstance instance, String orderId, String sessionId) {
        String session = sessionId == null || sessionId.isBlank() ? "" : "/" + sessionId;
        return "taler://pay/" + base(origin, instance, orderId) + session + insecure(origin);
    }

    public static String contractUrl(RequestOrigin origin, MerchantInstance instance, String orderId) {
        String scheme = origin.https() ? "https" : "http";
        String prefix = "-".equals(origin.effectivePrefix()) ? "" : "/" + origin.effectivePrefix();
        return scheme + "://" + origin.effectiveHost() + prefix
            + "/proposal?instance=" + instance.id() + "&order_id=" + orderId;
    }

    private static String base(RequestOrigin origin, MerchantInstance instance, String orderId) {
        String instanceSegment = instance.isDefault() ? "-" : instance.id();
        return origin.effectiveHost() + "/" + origin.effectivePrefix() + "/" + instanceSegment + "/" + orderId;
    }

    private static String insecure(RequestOrigin origin) {
        return origin.https() ? "" : "?insecure=1";
    }
}
