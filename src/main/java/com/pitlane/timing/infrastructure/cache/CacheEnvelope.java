package com.pitlane.timing.infrastructure.cache;

import java.time.Instant;

/**
 * What actually sits in the volatile tier: the payload plus when it was cached and for how long.
 */
public record CacheEnvelope<T>(T data, Instant cachedAt, long ttlSeconds) {}
