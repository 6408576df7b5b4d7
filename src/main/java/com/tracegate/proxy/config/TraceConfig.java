package com.tracegate.proxy.config;

/**
 * Configuration for the trace history and the trace/observer listener.
 */
public class TraceConfig {
    /** Bind address for the trace listener. Null means all interfaces. */
    private String bindAddress;

    /** Port serving /traces and /ws. */
    private int port = 8081;

    /** Number of traces kept in memory. Oldest entries are evicted first. */
    private int maxHistory = 100;

    /** Maximum concurrent observer and query connections. */
    private int maxConnections = 1000;

    public String getBindAddress() {
        return bindAddress;
    }

    public void setBindAddress(String bindAddress) {
        this.bindAddress = bindAddress;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public int getMaxHistory() {
        return maxHistory;
    }

    public void setMaxHistory(int maxHistory) {
        this.maxHistory = maxHistory;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
    }
}
