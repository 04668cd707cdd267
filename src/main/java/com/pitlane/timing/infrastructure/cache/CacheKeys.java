package com.pitlane.timing.infrastructure.cache;

import com.pitlane.timing.domain.model.SessionId;

/**
 * Key layout of the volatile tier. Every key lives under the application namespace:
 * <pre>
 *   {ns}:session:{year}:{round}:{sessionKey}
 *   {ns}:event:{year}:{round}
 *   {ns}:schedule:{year}
 * </pre>
 */
public class CacheKeys {

    private final String namespace;

    public CacheKeys(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("Cache namespace is required");
        }
        this.namespace = namespace;
    }

    public String session(SessionId id) {
        return namespace + ":session:" + id.year() + ":" + id.round() + ":" + id.sessionKey();
    }

    /**
     * Prefix shared by every session key of one event. The trailing colon keeps round 1
     * from matching round 10.
     */
    public String sessionPrefix(int year, int round) {
        return namespace + ":session:" + year + ":" + round + ":";
    }

    public String event(int year, int round) {
        return namespace + ":event:" + year + ":" + round;
    }

    public String schedule(int year) {
        return namespace + ":schedule:" + year;
    }

    public String namespacePrefix() {
        return namespace + ":";
    }
}
