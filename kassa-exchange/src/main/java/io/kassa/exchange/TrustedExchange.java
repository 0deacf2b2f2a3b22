package io.kassa.exchange;

/**
 * An exchange listed in the merchant's configuration. When {@code masterPublicKey} is set, the
 * exchange is only trusted while its keys are signed by that master key.
 */
public record TrustedExchange(String url, String masterPublicKey) {
}
