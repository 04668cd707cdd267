package com.pitlane.timing.domain.port.out;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared key/value tier with per-entry TTL.
 * <p>
 * Implementations never throw: connectivity problems switch them to an in-process fallback
 * with the same TTL rules, and every other failure is reported through the return value.
 */
public interface VolatileCache {

    /**
     * @return true when the backing service answered; false leaves the cache in fallback mode
     */
    boolean connect();

    void disconnect();

    /**
     * A failed ping switches the cache to fallback mode.
     */
    boolean ping();

    boolean isConnected();

    Optional<String> get(String key);

    boolean set(String key, String value, Duration ttl);

    boolean delete(String key);

    /**
     * @return number of keys removed
     */
    long deleteByPrefix(String prefix);

    void clearFallback();

    int fallbackEntryCount();

    /**
     * @return number of live keys under the prefix, or -1 if they could not be counted
     */
    long countKeys(String prefix);
}
