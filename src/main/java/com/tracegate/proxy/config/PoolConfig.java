package com.tracegate.proxy.config;

/**
 * Bounds for the upstream HTTP connection pool.
 * The gateway talks to a single upstream host, so the per-host bound and the
 * global bound coincide.
 */
public class PoolConfig {
    private int maxIdleConnections = 100;
    private int idleTimeoutSeconds = 30;

    public int getMaxIdleConnections() {
        return maxIdleConnections;
    }

    public void setMaxIdleConnections(int maxIdleConnections) {
        this.maxIdleConnections = maxIdleConnections;
    }

    public int getIdleTimeoutSeconds() {
        return idleTimeoutSeconds;
    }

    public void setIdleTimeoutSeconds(int idleTimeoutSeconds) {
        this.idleTimeoutSeconds = idleTimeoutSeconds;
    }
}
