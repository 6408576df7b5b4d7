package com.tracegate.proxy.config;

import java.net.URI;

import com.tracegate.proxy.core.exceptions.ConfigException;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Root configuration object for Tracegate.
 * Maps to the top-level structure of application.yml.
 */
public class TracegateProperties {
    /**
     * Proxy listener and upstream settings.
     */
    private GatewayConfig gateway = new GatewayConfig();

    /**
     * Trace history and observer endpoint settings.
     */
    private TraceConfig traces = new TraceConfig();

    /**
     * Hook script settings.
     */
    private HookConfig hooks = new HookConfig();

    /**
     * Administration and metrics configuration.
     */
    private AdminConfig admin = new AdminConfig();

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public GatewayConfig getGateway() {
        return gateway;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setGateway(GatewayConfig gateway) {
        this.gateway = gateway;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public TraceConfig getTraces() {
        return traces;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setTraces(TraceConfig traces) {
        this.traces = traces;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public HookConfig getHooks() {
        return hooks;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setHooks(HookConfig hooks) {
        this.hooks = hooks;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public AdminConfig getAdmin() {
        return admin;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setAdmin(AdminConfig admin) {
        this.admin = admin;
    }

    /**
     * Checks the loaded values for settings the listeners cannot start with.
     * 
     * @throws ConfigException If a section is missing or a value is out of range.
     */
    public void validate() {
        if (gateway == null || traces == null || hooks == null || admin == null) {
            throw new ConfigException("Configuration sections gateway, traces, hooks and admin must not be empty");
        }
        checkPort("gateway.port", gateway.getPort());
        checkPort("traces.port", traces.getPort());
        if (admin.isEnabled()) {
            checkPort("admin.port", admin.getPort());
        }
        String upstream = gateway.getUpstream();
        if (upstream == null) {
            throw new ConfigException("gateway.upstream must be set");
        }
        try {
            URI uri = URI.create(upstream);
            if (uri.getHost() == null || !("http".equals(uri.getScheme()) || "https".equals(uri.getScheme()))) {
                throw new ConfigException("gateway.upstream must be an absolute http(s) URL: " + upstream);
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigException("gateway.upstream is not a valid URL: " + upstream, e);
        }
        String prefix = gateway.getPathPrefix();
        if (prefix == null || !prefix.startsWith("/")) {
            throw new ConfigException("gateway.pathPrefix must start with '/': " + prefix);
        }
        if (gateway.getMaxConnections() < 1 || traces.getMaxConnections() < 1) {
            throw new ConfigException("maxConnections must be positive");
        }
        if (traces.getMaxHistory() < 1) {
            throw new ConfigException("traces.maxHistory must be positive: " + traces.getMaxHistory());
        }
        if (hooks.getTimeoutMillis() < 0) {
            throw new ConfigException("hooks.timeoutMillis must not be negative: " + hooks.getTimeoutMillis());
        }
    }

    private static void checkPort(String name, int port) {
        if (port < 0 || port > 65535) {
            throw new ConfigException(name + " out of range: " + port);
        }
    }
}
