package com.tracegate.proxy.config;

/**
 * Configuration for the admin listener that serves /health and the Prometheus
 * scrape at /metrics.
 */
public class AdminConfig {
    private boolean enabled = true;
    private int port = 9090;
    /** Loopback by default; metrics include upstream error counts. */
    private String bindAddress = "127.0.0.1";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getBindAddress() {
        return bindAddress;
    }

    public void setBindAddress(String bindAddress) {
        this.bindAddress = bindAddress;
    }
}
