package com.pitlane.timing.infrastructure.cache;

import com.pitlane.timing.domain.port.out.VolatileCache;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Redis-backed volatile tier with transparent in-process fallback.
 * <p>
 * While connected every call goes to Redis. A connectivity failure (refused connection,
 * command timeout) flips the cache into fallback mode and the same call is answered from
 * {@link InProcessTtlCache}. Only {@link #connect()} brings Redis back.
 * <p>
 * A key lives in at most one backend. A successful Redis write drops the fallback copy, deletes
 * hit both, and reconnecting moves the entries written during the outage into Redis with their
 * remaining TTL before Redis serves reads again. A non-positive TTL is replaced by the default.
 */
@Component
public class RedisVolatileCache implements VolatileCache {

    private static final Logger logger = LoggerFactory.getLogger(RedisVolatileCache.class);

    private static final int SCAN_BATCH_SIZE = 500;
    private static final int MAX_RECONCILE_PASSES = 5;

    private final StringRedisTemplate redisTemplate;
    private final InProcessTtlCache fallback;
    private final TimingCacheProperties properties;

    private volatile boolean connected;

    public RedisVolatileCache(StringRedisTemplate redisTemplate,
                              InProcessTtlCache fallback,
                              TimingCacheProperties properties) {
        this.redisTemplate = redisTemplate;
        this.fallback = fallback;
        this.properties = properties;
    }

    @Override
    public boolean connect() {
        if (!properties.isRedisEnabled()) {
            logger.warn("Redis disabled by configuration, using in-process cache fallback");
            connected = false;
            return false;
        }

        boolean wasConnected = connected;
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            if (pong == null) {
                logger.warn("Redis did not answer ping, using in-process cache fallback");
                connected = false;
            } else if (wasConnected) {
                connected = true;
            } else {
                moveFallbackEntriesToRedis();
                connected = true;
                logger.info("Connected to Redis volatile cache");
            }
        } catch (RuntimeException e) {
            logger.warn("Failed to connect to Redis: {}. Using in-process cache fallback.", e.getMessage());
            connected = false;
        }
        return connected;
    }

    @Override
    public void disconnect() {
        if (connected) {
            logger.info("Disconnecting from Redis volatile cache");
        }
        connected = false;
    }

    @Override
    public boolean ping() {
        if (!properties.isRedisEnabled()) {
            return false;
        }
        try {
            return redisTemplate.execute((RedisCallback<String>) RedisConnection::ping) != null;
        } catch (RuntimeException e) {
            degrade("ping", e);
            return false;
        }
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public Optional<String> get(String key) {
        if (connected) {
            try {
                return Optional.ofNullable(redisTemplate.opsForValue().get(key));
            } catch (RuntimeException e) {
                if (!handleFailure("get", key, e)) {
                    return Optional.empty();
                }
            }
        }
        return fallback.get(key);
    }

    @Override
    public boolean set(String key, String value, Duration ttl) {
        Duration effectiveTtl = ttl == null || ttl.isZero() || ttl.isNegative() ? properties.defaultTtl() : ttl;
        if (connected) {
            try {
                redisTemplate.opsForValue().set(key, value, effectiveTtl);
                fallback.remove(key);
                return true;
            } catch (RuntimeException e) {
                if (!handleFailure("set", key, e)) {
                    return false;
                }
            }
        }
        fallback.put(key, value, effectiveTtl);
        return true;
    }

    @Override
    public boolean delete(String key) {
        boolean ok = true;
        if (connected) {
            try {
                redisTemplate.delete(key);
            } catch (RuntimeException e) {
                ok = handleFailure("delete", key, e);
            }
        }
        fallback.remove(key);
        return ok;
    }

    @Override
    public long deleteByPrefix(String prefix) {
        long removed = 0;
        if (connected) {
            try {
                Long count = redisTemplate.execute((RedisCallback<Long>) connection -> scanAndDelete(connection, prefix));
                removed += count != null ? count : 0;
            } catch (RuntimeException e) {
                handleFailure("deleteByPrefix", prefix, e);
            }
        }
        removed += fallback.removeByPrefix(prefix);
        logger.debug("Deleted {} keys with prefix {}", removed, prefix);
        return removed;
    }

    @Override
    public void clearFallback() {
        fallback.clear();
    }

    @Override
    public int fallbackEntryCount() {
        return fallback.size();
    }

    @Override
    public long countKeys(String prefix) {
        if (!connected) {
            return fallback.countByPrefix(prefix);
        }
        try {
            Long count = redisTemplate.execute((RedisCallback<Long>) connection -> {
                long keys = 0;
                try (Cursor<byte[]> cursor = connection.keyCommands().scan(scanOptions(prefix))) {
                    while (cursor.hasNext()) {
                        cursor.next();
                        keys++;
                    }
                }
                return keys;
            });
            return count != null ? count : -1;
        } catch (RuntimeException e) {
            handleFailure("countKeys", prefix, e);
            return -1;
        }
    }

    /**
     * Copies every live fallback entry into Redis, overwriting what Redis held from before the
     * outage, and drops each copied entry from the fallback map. Writes keep landing in the
     * fallback map until {@code connected} flips, so this repeats a bounded number of passes;
     * keys still rewritten after the last pass are dropped from both backends.
     * A failure propagates and leaves the remaining entries in the fallback map.
     */
    private void moveFallbackEntriesToRedis() {
        int moved = 0;
        Map<String, InProcessTtlCache.Entry> pending = fallback.liveEntries();
        for (int pass = 0; pass < MAX_RECONCILE_PASSES && !pending.isEmpty(); pass++) {
            for (Map.Entry<String, InProcessTtlCache.Entry> e : pending.entrySet()) {
                Duration remaining = fallback.remainingTtl(e.getValue());
                if (!remaining.isZero() && !remaining.isNegative()) {
                    redisTemplate.opsForValue().set(e.getKey(), e.getValue().value(), remaining);
                    moved++;
                }
                fallback.removeIfUnchanged(e.getKey(), e.getValue());
            }
            pending = fallback.liveEntries();
        }
        if (!pending.isEmpty()) {
            redisTemplate.delete(pending.keySet());
            pending.keySet().forEach(fallback::remove);
            logger.warn("Dropped {} keys still being rewritten while reconnecting", pending.size());
        }
        if (moved > 0) {
            logger.info("Moved {} entries written during the outage into Redis", moved);
        }
    }

    private long scanAndDelete(RedisConnection connection, String prefix) {
        long deleted = 0;
        List<byte[]> batch = new ArrayList<>(SCAN_BATCH_SIZE);

        try (Cursor<byte[]> cursor = connection.keyCommands().scan(scanOptions(prefix))) {
            while (cursor.hasNext()) {
                batch.add(cursor.next());
                if (batch.size() >= SCAN_BATCH_SIZE) {
                    deleted += deleteBatch(connection, batch);
                    batch.clear();
                }
            }
        }
        if (!batch.isEmpty()) {
            deleted += deleteBatch(connection, batch);
        }
        return deleted;
    }

    private long deleteBatch(RedisConnection connection, List<byte[]> keys) {
        Long deleted = connection.keyCommands().del(keys.toArray(new byte[0][]));
        return deleted != null ? deleted : 0;
    }

    private ScanOptions scanOptions(String prefix) {
        return ScanOptions.scanOptions()
                .match(escapeGlob(prefix) + "*")
                .count(SCAN_BATCH_SIZE)
                .build();
    }

    /**
     * @return true when the failure was a lost connection and the call should be retried
     *         against the fallback map
     */
    private boolean handleFailure(String operation, String key, RuntimeException e) {
        if (isConnectivityFailure(e)) {
            degrade(operation, e);
            return true;
        }
        logger.warn("Redis {} failed for {}: {}", operation, key, e.getMessage());
        return false;
    }

    private void degrade(String operation, RuntimeException e) {
        if (connected) {
            logger.warn("Lost Redis connection during {}: {}. Switching to in-process cache fallback.",
                    operation, e.getMessage());
        }
        connected = false;
    }

    private static boolean isConnectivityFailure(RuntimeException e) {
        return e instanceof DataAccessResourceFailureException || e instanceof QueryTimeoutException;
    }

    static String escapeGlob(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
