package com.pitlane.timing.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Location and connection settings of the SQLite durable store
 */
@Component
@ConfigurationProperties(prefix = "pitlane.store")
public class DurableStoreProperties {

    private String path = "f1_data.db";
    private int poolSize = 4;
    private int busyTimeoutMillis = 5000;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public int getBusyTimeoutMillis() {
        return busyTimeoutMillis;
    }

    public void setBusyTimeoutMillis(int busyTimeoutMillis) {
        this.busyTimeoutMillis = busyTimeoutMillis;
    }

    public String jdbcUrl() {
        return "jdbc:sqlite:" + path;
    }
}
