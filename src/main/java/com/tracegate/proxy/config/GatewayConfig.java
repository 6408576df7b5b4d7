package com.tracegate.proxy.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Configuration for the forwarding listener and its upstream.
 */
public class GatewayConfig {
    /** Host name or IP the proxy listener binds to. */
    private String host = "localhost";

    /** Port the proxy listener binds to. */
    private int port = 8080;

    /** Base URL of the upstream API. Path and query of each request are appended. */
    private String upstream = "https://api.openai.com";

    /** Only paths starting with this prefix are forwarded. */
    private String pathPrefix = "/v1/";

    /** Upstream connect and response-header timeout in milliseconds. Default is 30s. */
    private int timeoutMillis = 30000;

    /** Maximum concurrent client connections. */
    private int maxConnections = 10000;

    /** Whether client connections are kept open between requests. */
    private boolean keepAlive = true;

    /** Idle timeout for client connections in milliseconds. */
    private int clientIdleTimeoutMillis = 60000;

    /** Upstream connection pool bounds. */
    private PoolConfig pool = new PoolConfig();

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getUpstream() {
        return upstream;
    }

    public void setUpstream(String upstream) {
        this.upstream = upstream;
    }

    public String getPathPrefix() {
        return pathPrefix;
    }

    public void setPathPrefix(String pathPrefix) {
        this.pathPrefix = pathPrefix;
    }

    public int getTimeoutMillis() {
        return timeoutMillis;
    }

    public void setTimeoutMillis(int timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
    }

    public boolean isKeepAlive() {
        return keepAlive;
    }

    public void setKeepAlive(boolean keepAlive) {
        this.keepAlive = keepAlive;
    }

    public int getClientIdleTimeoutMillis() {
        return clientIdleTimeoutMillis;
    }

    public void setClientIdleTimeoutMillis(int clientIdleTimeoutMillis) {
        this.clientIdleTimeoutMillis = clientIdleTimeoutMillis;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public PoolConfig getPool() {
        return pool;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setPool(PoolConfig pool) {
        this.pool = pool;
    }
}
