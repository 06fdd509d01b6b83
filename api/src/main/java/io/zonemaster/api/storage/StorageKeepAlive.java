package io.zonemaster.api.storage;

/**
 * Periodic keep-alive for the external account/session storage.
 *
 * <p>The master pings at a fixed tick interval so idle connections to the
 * storage are not dropped.</p>
 */
@FunctionalInterface
public interface StorageKeepAlive {

    /**
     * Keep-alive that does nothing, for masters without external storage.
     */
    StorageKeepAlive NONE = () -> { };

    /**
     * Touch the storage.
     */
    void ping();
}
