package io.kassa.cli;

/**
 * Starts the merchant backend and blocks until it has shut down. Null arguments keep the
 * configured values.
 */
@FunctionalInterface
public interface ServerRunner {
    int run(Integer portOverride, String hostOverride) throws Exception;
}
