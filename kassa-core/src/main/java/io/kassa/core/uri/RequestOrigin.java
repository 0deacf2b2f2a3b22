package io.kassa.core.uri;

/**
 * Where a request came from, as far as building {@code taler://} URIs is concerned.
 */
public record RequestOrigin(String host, String forwardedHost, String forwardedPrefix, boolean https) {

    public static RequestOrigin of(String host, boolean https) {
        return new RequestOrigin(host, null, null, https);
    }

    public String effectiveHost() {
        return isSet(forwardedHost) ? forwardedHost : host;
    }

    public String effectivePrefix() {
        if (!isSet(forwardedPrefix)) {
            return "-";
        }
        String trimmed = forwardedPrefix.replaceAll("^/+", "").replaceAll("/+$", "");
        return trimmed.isEmpty() ? "-" : trimmed;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
