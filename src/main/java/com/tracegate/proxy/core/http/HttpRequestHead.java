package com.tracegate.proxy.core.http;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

import com.tracegate.proxy.core.constants.HeaderConstants;
import com.tracegate.proxy.core.exceptions.ProtocolException;
import com.tracegate.proxy.core.utils.IoUtils;

/**
 * Request line and headers of an inbound HTTP/1.x request.
 *
 * @param method  Request method, as sent.
 * @param target  Request target (origin-form or absolute-form).
 * @param version Protocol version token, e.g. {@code HTTP/1.1}.
 * @param headers Request headers.
 */
public record HttpRequestHead(String method, String target, String version, HeaderMap headers) {

    private static final int MAX_HTTP_HEADERS = 100;

    /**
     * Reads the request line and headers from the stream.
     * 
     * @param in Client input stream, positioned at the start of a request.
     * @return The parsed head, or null if the client closed the connection
     *         before sending a request line.
     * @throws IOException       If reading fails.
     * @throws ProtocolException If the request line or headers are malformed.
     */
    public static HttpRequestHead read(InputStream in) throws IOException {
        String requestLine = IoUtils.readLine(in);
        while (requestLine != null && requestLine.isEmpty()) {
            // Tolerate stray CRLF between pipelined requests
            requestLine = IoUtils.readLine(in);
        }
        if (requestLine == null) {
            return null;
        }

        String[] parts = requestLine.split(" ");
        if (parts.length != 3 || !parts[2].startsWith("HTTP/")) {
            throw new ProtocolException("Malformed request line: " + requestLine);
        }

        HeaderMap headers = new HeaderMap();
        String line;
        int headerCount = 0;
        while ((line = IoUtils.readLine(in)) != null && !line.isEmpty()) {
            if (++headerCount > MAX_HTTP_HEADERS) {
                throw new ProtocolException("Too many HTTP headers (exceeds limit of " + MAX_HTTP_HEADERS + ")");
            }
            int idx = line.indexOf(':');
            if (idx <= 0) {
                throw new ProtocolException("Malformed header line: " + line);
            }
            headers.add(line.substring(0, idx).trim(), line.substring(idx + 1).trim());
        }
        return new HttpRequestHead(parts[0], parts[1], parts[2], headers);
    }

    /**
     * @return Declared Content-Length, or -1 if absent.
     * @throws ProtocolException If the header is not a non-negative number.
     */
    public long contentLength() {
        String value = headers.first(HeaderConstants.CONTENT_LENGTH.getValue());
        if (value == null) {
            return -1;
        }
        try {
            long length = Long.parseLong(value.trim());
            if (length < 0) {
                throw new ProtocolException("Negative Content-Length: " + value);
            }
            return length;
        } catch (NumberFormatException e) {
            throw new ProtocolException("Invalid Content-Length: " + value, e);
        }
    }

    public boolean isChunked() {
        String te = headers.first(HeaderConstants.TRANSFER_ENCODING.getValue());
        return te != null && te.toLowerCase(Locale.ROOT).contains("chunked");
    }

    /**
     * @return True if the client asked for the connection to be closed, or spoke
     *         HTTP/1.0 without asking for keep-alive.
     */
    public boolean wantsClose() {
        String connection = headers.first(HeaderConstants.CONNECTION.getValue());
        if ("HTTP/1.0".equals(version)) {
            return !"keep-alive".equalsIgnoreCase(connection);
        }
        return "close".equalsIgnoreCase(connection);
    }

    public boolean isWebSocketUpgrade() {
        return "websocket".equalsIgnoreCase(headers.first(HeaderConstants.UPGRADE.getValue()));
    }
}
