package com.tracegate.proxy.core.server.gateway;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import com.tracegate.proxy.config.GatewayConfig;
import com.tracegate.proxy.core.codec.ContentCodec;
import com.tracegate.proxy.core.constants.HeaderConstants;
import com.tracegate.proxy.core.exceptions.ProtocolException;
import com.tracegate.proxy.core.hook.HookManager;
import com.tracegate.proxy.core.hook.HookResult;
import com.tracegate.proxy.core.hook.MessageDigestHook;
import com.tracegate.proxy.core.http.ChunkedOutputStream;
import com.tracegate.proxy.core.http.HeaderMap;
import com.tracegate.proxy.core.http.HttpRequestHead;
import com.tracegate.proxy.core.http.HttpStatusText;
import com.tracegate.proxy.core.server.AbstractSocketServer;
import com.tracegate.proxy.core.trace.Trace;
import com.tracegate.proxy.core.trace.TraceHub;
import com.tracegate.proxy.core.utils.IoUtils;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Reverse-proxy listener that forwards API calls to the configured upstream.
 * <p>
 * Every request under the path prefix is read completely, run through the
 * message digest and the user's request hook, and sent upstream with the JDK
 * {@link HttpClient}. Event-stream and plain-text responses are relayed as they
 * arrive; all other responses are buffered, decoded and run through the
 * response hook. Each completed exchange is published to the {@link TraceHub}.
 * </p>
 */
public class GatewayServer extends AbstractSocketServer {

    private static final int HTTP_BAD_REQUEST = 400;
    private static final int HTTP_NOT_FOUND = 404;
    private static final int HTTP_INTERNAL_ERROR = 500;
    private static final int HTTP_BAD_GATEWAY = 502;

    static final String READ_BODY_FAILED_MSG = "Failed to read request body";
    static final String CREATE_REQUEST_FAILED_MSG = "Failed to create request";
    static final String FORWARD_FAILED_MSG = "Failed to forward request";
    static final String READ_RESPONSE_FAILED_MSG = "Failed to read response";

    private static final String HTTP_1_0 = "HTTP/1.0";
    private static final byte[] CONTINUE_RESPONSE = "HTTP/1.1 100 Continue\r\n\r\n"
            .getBytes(StandardCharsets.US_ASCII);

    private final GatewayConfig config;
    private final String upstreamBase;
    private final String pathPrefix;
    private final HttpClient httpClient;
    private final HookManager hookManager;
    private final MessageDigestHook digestHook = new MessageDigestHook();
    private final TraceHub traceHub;

    private final Counter requestsTotal;
    private final Counter upstreamErrors;
    private final Counter streamedResponses;
    private final Counter bufferedResponses;
    private final Counter bytesStreamed;

    /**
     * Outcome of writing a response to the client.
     *
     * @param traceBody Response body text recorded in the trace.
     * @param reusable  Whether the client connection may carry another request.
     */
    private record Delivery(String traceBody, boolean reusable) {
    }

    /**
     * @param config      Gateway settings.
     * @param httpClient  Shared upstream client.
     * @param hookManager User hook scripts.
     * @param traceHub    Receiver of completed exchanges.
     * @param registry    The Micrometer meter registry.
     */
    public GatewayServer(GatewayConfig config, HttpClient httpClient, HookManager hookManager, TraceHub traceHub,
            MeterRegistry registry) {
        super("Gateway", config.getHost(), config.getPort(), config.getMaxConnections(),
                config.getClientIdleTimeoutMillis(), registry);
        this.config = config;
        this.httpClient = httpClient;
        this.hookManager = hookManager;
        this.traceHub = traceHub;
        this.pathPrefix = config.getPathPrefix();
        String upstream = config.getUpstream();
        this.upstreamBase = upstream.endsWith("/") ? upstream.substring(0, upstream.length() - 1) : upstream;

        this.requestsTotal = Counter.builder("gateway.requests.total")
                .description("Total number of requests received")
                .register(registry);
        this.upstreamErrors = Counter.builder("gateway.upstream.errors")
                .description("Requests that could not be forwarded upstream")
                .register(registry);
        this.streamedResponses = Counter.builder("gateway.responses.streamed")
                .description("Responses relayed as a stream")
                .register(registry);
        this.bufferedResponses = Counter.builder("gateway.responses.buffered")
                .description("Responses buffered and passed through the response hook")
                .register(registry);
        this.bytesStreamed = Counter.builder("gateway.bytes.streamed")
                .description("Total bytes relayed in streamed responses")
                .register(registry);
    }

    @Override
    public void stop() {
        super.stop();
        registry.remove(requestsTotal);
        registry.remove(upstreamErrors);
        registry.remove(streamedResponses);
        registry.remove(bufferedResponses);
        registry.remove(bytesStreamed);
    }

    /**
     * Serves requests on one client connection until it closes or asks to.
     */
    @Override
    protected void handleClient(Socket client) {
        String remoteAddr = client.getInetAddress().getHostAddress();
        try {
            InputStream in = new BufferedInputStream(client.getInputStream());
            OutputStream out = new BufferedOutputStream(client.getOutputStream(), IoUtils.DEFAULT_BUFFER_SIZE);

            while (!client.isClosed() && processNextRequest(in, out, remoteAddr)) {
                // Keep-alive: next request on the same connection
            }
        } catch (SocketTimeoutException e) {
            log.debug("Gateway client {} idle, closing connection", remoteAddr);
        } catch (IOException e) {
            log.debug("Gateway client {} I/O error: {}", remoteAddr, e.getMessage());
        }
    }

    /**
     * Handles one request.
     * 
     * @return True if the connection can carry another request.
     */
    private boolean processNextRequest(InputStream in, OutputStream out, String remoteAddr) throws IOException {
        HttpRequestHead head;
        try {
            head = HttpRequestHead.read(in);
        } catch (ProtocolException e) {
            log.warn("HTTP protocol error from {}: {}", remoteAddr, e.getMessage());
            writeError(out, HTTP_BAD_REQUEST, "Malformed request");
            return false;
        }
        if (head == null) {
            return false;
        }

        requestsTotal.increment();
        Instant timestamp = Instant.now();
        long startNanos = System.nanoTime();

        String path;
        String query;
        try {
            String target = head.target();
            if (target.startsWith("http://") || target.startsWith("https://")) {
                URI uri = URI.create(target);
                path = uri.getRawPath();
                query = uri.getRawQuery();
            } else {
                int q = target.indexOf('?');
                path = q >= 0 ? target.substring(0, q) : target;
                query = q >= 0 ? target.substring(q + 1) : null;
            }
        } catch (IllegalArgumentException e) {
            log.warn("Invalid request target from {}: {}", remoteAddr, head.target());
            writeError(out, HTTP_BAD_REQUEST, "Malformed request");
            return false;
        }

        if (path == null || !path.startsWith(pathPrefix)) {
            log.debug("Rejecting {} {} from {}: outside {}", head.method(), path, remoteAddr, pathPrefix);
            writeError(out, HTTP_NOT_FOUND, "Only " + pathPrefix + " endpoints are supported");
            return false;
        }

        boolean keepAlive = config.isKeepAlive() && !head.wantsClose();

        byte[] body;
        try {
            body = readRequestBody(head, in, out);
        } catch (IOException | ProtocolException e) {
            log.warn("Failed to read request body from {}: {}", remoteAddr, e.getMessage());
            writeError(out, HTTP_INTERNAL_ERROR, READ_BODY_FAILED_MSG);
            return false;
        }

        HookResult request = hookManager.runRequestHook(digestHook.apply(body), head.headers());

        String url = upstreamBase + path + (query != null ? "?" + query : "");
        HeaderMap recordedHeaders = withoutHopByHop(request.headers());
        HttpRequest upstreamRequest;
        try {
            upstreamRequest = buildRequest(head.method(), url, request.body(), upstreamHeaders(recordedHeaders));
        } catch (IllegalArgumentException e) {
            log.error("Failed to create upstream request {} {}: {}", head.method(), url, e.getMessage());
            writeError(out, HTTP_INTERNAL_ERROR, CREATE_REQUEST_FAILED_MSG);
            return false;
        }

        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(upstreamRequest, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            upstreamErrors.increment();
            log.error("Failed to forward {} {}: {}", head.method(), url, e.toString());
            writeError(out, HTTP_BAD_GATEWAY, FORWARD_FAILED_MSG);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            upstreamErrors.increment();
            log.error("Forwarding {} {} interrupted", head.method(), url);
            writeError(out, HTTP_BAD_GATEWAY, FORWARD_FAILED_MSG);
            return false;
        }
        double latency = (System.nanoTime() - startNanos) / 1_000_000_000.0;

        Delivery delivery = deliverResponse(head, response, out, keepAlive);
        if (delivery == null) {
            return false;
        }

        int status = response.statusCode();
        log.info("{} {} -> {} ({} ms)", head.method(), path, status, Math.round(latency * 1000));
        traceHub.publish(new Trace(
                Trace.newId(),
                timestamp,
                head.method(),
                url,
                HttpStatusText.statusLine(status),
                latency,
                response.headers().firstValue(HeaderConstants.SESSION_ID.getValue()).orElse(null),
                recordedHeaders.toMap(),
                new String(request.body(), StandardCharsets.UTF_8),
                delivery.traceBody()));
        return delivery.reusable();
    }

    private byte[] readRequestBody(HttpRequestHead head, InputStream in, OutputStream out) throws IOException {
        boolean chunked = head.isChunked();
        long length = chunked ? -1 : head.contentLength();
        if (!chunked && length <= 0) {
            return new byte[0];
        }
        String expect = head.headers().first(HeaderConstants.EXPECT.getValue());
        if ("100-continue".equalsIgnoreCase(expect)) {
            out.write(CONTINUE_RESPONSE);
            out.flush();
        }
        return chunked ? IoUtils.readChunkedBody(in) : IoUtils.readFixedBody(in, length);
    }

    /**
     * Copies the effective request headers minus hop-by-hop ones, and asks the
     * upstream for an unencoded body.
     */
    /**
     * Headers recorded in the trace: the hook output without hop-by-hop fields.
     */
    private static HeaderMap withoutHopByHop(HeaderMap headers) {
        HeaderMap result = new HeaderMap();
        headers.forEachValue((name, value) -> {
            if (!HeaderConstants.isHopByHop(name)) {
                result.add(name, value);
            }
        });
        return result;
    }

    private static HeaderMap upstreamHeaders(HeaderMap recorded) {
        HeaderMap result = new HeaderMap(recorded);
        result.set(HeaderConstants.ACCEPT_ENCODING.getValue(), "identity");
        return result;
    }

    private HttpRequest buildRequest(String method, String url, byte[] body, HeaderMap headers) {
        HttpRequest.Builder rb = HttpRequest.newBuilder(URI.create(url))
                .version(HttpClient.Version.HTTP_1_1)
                .method(method, body.length == 0
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofByteArray(body));
        if (config.getTimeoutMillis() > 0) {
            rb.timeout(Duration.ofMillis(config.getTimeoutMillis()));
        }
        headers.forEachValue(rb::header);
        return rb.build();
    }

    /**
     * Writes the upstream response to the client in the mode its content type
     * calls for.
     * 
     * @return The delivery outcome, or null if the response was aborted and the
     *         connection must be closed.
     */
    private Delivery deliverResponse(HttpRequestHead head, HttpResponse<InputStream> response, OutputStream out,
            boolean keepAlive) throws IOException {
        int status = response.statusCode();
        HeaderMap headers = clientHeaders(response.headers());

        if ("HEAD".equalsIgnoreCase(head.method()) || HttpStatusText.forbidsBody(status)) {
            IoUtils.closeQuietly(response.body(), "upstream body");
            if ("HEAD".equalsIgnoreCase(head.method())) {
                response.headers().firstValue(HeaderConstants.CONTENT_LENGTH.getValue())
                        .ifPresent(v -> headers.set(HeaderConstants.CONTENT_LENGTH.getValue(), v));
            }
            writeHead(out, status, headers, keepAlive);
            out.flush();
            return new Delivery("", keepAlive);
        }

        ResponseMode mode = ResponseMode.classify(headers.first(HeaderConstants.CONTENT_TYPE.getValue()));
        if (mode == ResponseMode.STREAM) {
            return stream(head, response, headers, out, keepAlive);
        }
        return buffer(response, headers, out, keepAlive);
    }

    private Delivery stream(HttpRequestHead head, HttpResponse<InputStream> response, HeaderMap headers,
            OutputStream out, boolean keepAlive) {
        long declared = response.headers().firstValueAsLong(HeaderConstants.CONTENT_LENGTH.getValue()).orElse(-1L);
        boolean chunked = declared < 0 && !HTTP_1_0.equals(head.version());
        boolean reusable = keepAlive && (declared >= 0 || chunked);
        if (declared >= 0) {
            headers.set(HeaderConstants.CONTENT_LENGTH.getValue(), String.valueOf(declared));
        } else if (chunked) {
            headers.set(HeaderConstants.TRANSFER_ENCODING.getValue(), "chunked");
        }

        long copied;
        try (InputStream upstreamBody = response.body()) {
            writeHead(out, response.statusCode(), headers, reusable);
            out.flush();
            if (chunked) {
                ChunkedOutputStream chunkedOut = new ChunkedOutputStream(out);
                copied = IoUtils.copyFlushing(upstreamBody, chunkedOut);
                chunkedOut.finish();
            } else {
                copied = IoUtils.copyFlushing(upstreamBody, out);
            }
        } catch (IOException e) {
            log.warn("Streaming response aborted: {}", e.getMessage());
            return null;
        }
        streamedResponses.increment();
        bytesStreamed.increment(copied);
        return new Delivery(Trace.streamingPlaceholder(copied), reusable);
    }

    private Delivery buffer(HttpResponse<InputStream> response, HeaderMap headers, OutputStream out,
            boolean keepAlive) throws IOException {
        byte[] raw;
        try (InputStream upstreamBody = response.body()) {
            raw = upstreamBody.readAllBytes();
        } catch (IOException e) {
            upstreamErrors.increment();
            log.error("Failed to read upstream response: {}", e.getMessage());
            writeError(out, HTTP_INTERNAL_ERROR, READ_RESPONSE_FAILED_MSG);
            return null;
        }

        byte[] decoded = decode(raw, headers);
        HookResult result = hookManager.runResponseHook(decoded, headers);

        HeaderMap finalHeaders = new HeaderMap();
        result.headers().forEachValue((name, value) -> {
            if (!HeaderConstants.isHopByHop(name)) {
                finalHeaders.add(name, value);
            }
        });
        finalHeaders.set(HeaderConstants.CONTENT_LENGTH.getValue(), String.valueOf(result.body().length));

        writeHead(out, response.statusCode(), finalHeaders, keepAlive);
        out.write(result.body());
        out.flush();
        bufferedResponses.increment();
        return new Delivery(new String(result.body(), StandardCharsets.UTF_8), keepAlive);
    }

    /**
     * Undoes the response's content coding in place of the raw bytes. On success
     * the Content-Encoding header is removed; on failure the raw bytes and the
     * header are kept.
     */
    private byte[] decode(byte[] raw, HeaderMap headers) {
        String encoding = headers.first(HeaderConstants.CONTENT_ENCODING.getValue());
        if (!ContentCodec.isSupported(encoding)) {
            return raw;
        }
        try {
            byte[] decoded = ContentCodec.decompress(raw, encoding);
            headers.remove(HeaderConstants.CONTENT_ENCODING.getValue());
            return decoded;
        } catch (IOException e) {
            log.warn("Failed to decode {} response body, forwarding as received: {}", encoding, e.getMessage());
            return raw;
        }
    }

    private static HeaderMap clientHeaders(HttpHeaders upstream) {
        HeaderMap headers = new HeaderMap();
        upstream.map().forEach((name, values) -> {
            if (!name.startsWith(":") && !HeaderConstants.isHopByHop(name)) {
                values.forEach(v -> headers.add(name, v));
            }
        });
        return headers;
    }

    private void writeHead(OutputStream out, int status, HeaderMap headers, boolean keepAlive) throws IOException {
        StringBuilder sb = new StringBuilder(256);
        sb.append("HTTP/1.1 ").append(status).append(' ').append(HttpStatusText.reason(status)).append("\r\n");
        headers.forEachValue((name, value) -> {
            if (isWritable(name) && isWritable(value)) {
                sb.append(name).append(": ").append(value).append("\r\n");
            } else {
                log.warn("Dropping response header {} containing line breaks", name);
            }
        });
        sb.append(HeaderConstants.CONNECTION.getValue()).append(": ")
                .append(keepAlive ? "keep-alive" : "close").append("\r\n\r\n");
        out.write(sb.toString().getBytes(StandardCharsets.ISO_8859_1));
    }

    private static boolean isWritable(String s) {
        return s.indexOf('\r') < 0 && s.indexOf('\n') < 0;
    }

    /**
     * Writes a plain-text error response and marks the connection for closing.
     */
    private void writeError(OutputStream out, int status, String message) throws IOException {
        byte[] body = message.getBytes(StandardCharsets.UTF_8);
        String head = "HTTP/1.1 " + status + " " + HttpStatusText.reason(status) + "\r\n"
                + "Content-Type: text/plain; charset=utf-8\r\n"
                + "X-Content-Type-Options: nosniff\r\n"
                + "Content-Length: " + body.length + "\r\n"
                + "Connection: close\r\n\r\n";
        out.write(head.getBytes(StandardCharsets.US_ASCII));
        out.write(body);
        out.flush();
    }
}
