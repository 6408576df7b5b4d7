package com.tracegate.proxy.core.constants;

import java.util.Locale;

/**
 * HTTP header names the gateway reads, rewrites or strips.
 */
public enum HeaderConstants {
    /** Target host; set by the upstream client itself. */
    HOST("Host", true),
    /** Hop-by-hop connection options. */
    CONNECTION("Connection", true),
    /** Entity length; recomputed on each side. */
    CONTENT_LENGTH("Content-Length", true),
    /** Transfer coding; decoded on read, re-applied on write. */
    TRANSFER_ENCODING("Transfer-Encoding", true),
    /** Persistent connection parameters. */
    KEEP_ALIVE("Keep-Alive", true),
    /** Accepted transfer codings. */
    TE("TE", true),
    /** Trailer field announcement. */
    TRAILER("Trailer", true),
    /** Protocol switch request. */
    UPGRADE("Upgrade", true),
    /** Continue expectation; restricted by the JDK client. */
    EXPECT("Expect", true),
    /** Credentials addressed to an intermediary. */
    PROXY_AUTHORIZATION("Proxy-Authorization", true),
    /** Challenge issued by an intermediary. */
    PROXY_AUTHENTICATE("Proxy-Authenticate", true),
    /** Proxy connection options. */
    PROXY_CONNECTION("Proxy-Connection", true),
    CONTENT_TYPE("Content-Type", false),
    CONTENT_ENCODING("Content-Encoding", false),
    ACCEPT_ENCODING("Accept-Encoding", false),
    /** Session identifier reported by the upstream and copied into traces. */
    SESSION_ID("X-Session-Id", false),
    SEC_WEBSOCKET_KEY("Sec-WebSocket-Key", false),
    SEC_WEBSOCKET_ACCEPT("Sec-WebSocket-Accept", false);

    private final String value;
    private final boolean hopByHop;

    HeaderConstants(String value, boolean hopByHop) {
        this.value = value;
        this.hopByHop = hopByHop;
    }

    /**
     * Retrieves the standard string value of the header.
     * 
     * @return The standard string value of the header.
     */
    public String getValue() {
        return value;
    }

    /**
     * Checks whether a header must not be copied between the client side and the
     * upstream side of the gateway.
     * 
     * @param name Header name in any case.
     * @return True for hop-by-hop and client-restricted headers, including any
     *         {@code Proxy-*} header.
     */
    public static boolean isHopByHop(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.startsWith("proxy-")) {
            return true;
        }
        for (HeaderConstants h : values()) {
            if (h.hopByHop && h.value.equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }
}
