package com.tracegate.proxy.core.server.gateway;

import java.net.http.HttpClient;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tracegate.proxy.config.GatewayConfig;
import com.tracegate.proxy.config.PoolConfig;

/**
 * Builds the shared HTTP client used for upstream calls.
 */
public final class UpstreamClientFactory {

    private static final Logger log = LoggerFactory.getLogger(UpstreamClientFactory.class);

    static final String POOL_SIZE_PROPERTY = "jdk.httpclient.connectionPoolSize";
    static final String KEEPALIVE_PROPERTY = "jdk.httpclient.keepalive.timeout";

    private UpstreamClientFactory() {
        // Utility class
    }

    /**
     * Creates an HTTP/1.1 client that never follows redirects.
     * <p>
     * The JDK client reads its pool bounds from system properties once, when its
     * connection pool class is first loaded. They are set here unless already
     * given on the command line, so this must run before any other client is
     * built in the process.
     * </p>
     * 
     * @param config Gateway settings.
     * @return The client.
     */
    public static HttpClient create(GatewayConfig config) {
        PoolConfig pool = config.getPool();
        if (pool != null) {
            setIfAbsent(POOL_SIZE_PROPERTY, pool.getMaxIdleConnections());
            setIfAbsent(KEEPALIVE_PROPERTY, pool.getIdleTimeoutSeconds());
        }
        HttpClient.Builder builder = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .version(HttpClient.Version.HTTP_1_1);
        if (config.getTimeoutMillis() > 0) {
            builder.connectTimeout(Duration.ofMillis(config.getTimeoutMillis()));
        }
        return builder.build();
    }

    private static void setIfAbsent(String property, int value) {
        if (value > 0 && System.getProperty(property) == null) {
            System.setProperty(property, String.valueOf(value));
            log.debug("Set {}={}", property, value);
        }
    }
}
