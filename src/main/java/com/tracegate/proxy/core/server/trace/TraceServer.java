package com.tracegate.proxy.core.server.trace;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

import com.tracegate.proxy.config.TraceConfig;
import com.tracegate.proxy.core.constants.HeaderConstants;
import com.tracegate.proxy.core.exceptions.ProtocolException;
import com.tracegate.proxy.core.http.HttpRequestHead;
import com.tracegate.proxy.core.http.HttpStatusText;
import com.tracegate.proxy.core.server.AbstractSocketServer;
import com.tracegate.proxy.core.trace.TraceHub;
import com.tracegate.proxy.core.utils.JsonSupport;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Serves the trace history as JSON on {@code GET /traces} and live traces over
 * a WebSocket on {@code GET /ws}.
 */
public class TraceServer extends AbstractSocketServer {

    /** Path of the JSON history dump. */
    public static final String TRACES_PATH = "/traces";
    /** Path of the live WebSocket stream. */
    public static final String WEBSOCKET_PATH = "/ws";

    private static final int REQUEST_READ_TIMEOUT_MILLIS = 30_000;

    private final TraceHub traceHub;

    public TraceServer(TraceConfig config, TraceHub traceHub, MeterRegistry registry) {
        super("Trace", config.getBindAddress(), config.getPort(), config.getMaxConnections(),
                REQUEST_READ_TIMEOUT_MILLIS, registry);
        this.traceHub = traceHub;
    }

    @Override
    protected void handleClient(Socket client) {
        String remoteAddr = client.getInetAddress().getHostAddress();
        try {
            InputStream in = new BufferedInputStream(client.getInputStream());
            OutputStream out = new BufferedOutputStream(client.getOutputStream());

            HttpRequestHead head;
            try {
                head = HttpRequestHead.read(in);
            } catch (ProtocolException e) {
                log.warn("HTTP protocol error from {}: {}", remoteAddr, e.getMessage());
                writeResponse(out, 400, "text/plain; charset=utf-8", "Malformed request");
                return;
            }
            if (head == null) {
                return;
            }

            String target = head.target();
            int q = target.indexOf('?');
            String path = q >= 0 ? target.substring(0, q) : target;

            if (!"GET".equalsIgnoreCase(head.method())) {
                writeResponse(out, 405, "text/plain; charset=utf-8", "Method not allowed");
            } else if (TRACES_PATH.equals(path)) {
                writeResponse(out, 200, "application/json", JsonSupport.toJson(traceHub.history()));
            } else if (WEBSOCKET_PATH.equals(path)) {
                handleWebSocket(client, head, in, out, remoteAddr);
            } else {
                writeResponse(out, 404, "text/plain; charset=utf-8", "Not found");
            }
        } catch (IOException e) {
            log.debug("Trace client {} I/O error: {}", remoteAddr, e.getMessage());
        }
    }

    private void handleWebSocket(Socket client, HttpRequestHead head, InputStream in, OutputStream out,
            String remoteAddr) throws IOException {
        String key = head.headers().first(HeaderConstants.SEC_WEBSOCKET_KEY.getValue());
        if (!head.isWebSocketUpgrade() || key == null || key.isBlank()) {
            writeResponse(out, 400, "text/plain; charset=utf-8", "Expected a WebSocket upgrade request");
            return;
        }

        String handshake = "HTTP/1.1 101 Switching Protocols\r\n"
                + "Upgrade: websocket\r\n"
                + "Connection: Upgrade\r\n"
                + HeaderConstants.SEC_WEBSOCKET_ACCEPT.getValue() + ": " + WebSocketFrames.acceptKey(key) + "\r\n\r\n";
        out.write(handshake.getBytes(StandardCharsets.US_ASCII));
        out.flush();
        // Observers may stay silent indefinitely
        client.setSoTimeout(0);
        log.info("Trace WebSocket connected from {}", remoteAddr);

        WebSocketObserver observer = new WebSocketObserver(client, out);
        if (!traceHub.register(observer)) {
            return;
        }
        try {
            readUntilClosed(in, observer);
        } finally {
            traceHub.unregister(observer);
            observer.close();
            log.info("Trace WebSocket from {} closed", remoteAddr);
        }
    }

    /**
     * Consumes client frames: pings are answered, a close frame is echoed and
     * ends the session, everything else is ignored.
     */
    private void readUntilClosed(InputStream in, WebSocketObserver observer) {
        try {
            while (!observer.isClosed()) {
                WebSocketFrames.Frame frame = WebSocketFrames.readFrame(in);
                switch (frame.opcode()) {
                    case WebSocketFrames.OPCODE_PING:
                        observer.pong(frame.payload());
                        break;
                    case WebSocketFrames.OPCODE_CLOSE:
                        observer.replyClose(frame.payload());
                        return;
                    default:
                        log.trace("Ignoring WebSocket frame with opcode {}", frame.opcode());
                        break;
                }
            }
        } catch (EOFException e) {
            log.debug("Trace WebSocket peer disconnected");
        } catch (IOException | ProtocolException e) {
            log.debug("Trace WebSocket read ended: {}", e.getMessage());
        }
    }

    private void writeResponse(OutputStream out, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        String head = "HTTP/1.1 " + HttpStatusText.statusLine(status) + "\r\n"
                + HeaderConstants.CONTENT_TYPE.getValue() + ": " + contentType + "\r\n"
                + HeaderConstants.CONTENT_LENGTH.getValue() + ": " + bytes.length + "\r\n"
                + "Connection: close\r\n\r\n";
        out.write(head.getBytes(StandardCharsets.US_ASCII));
        out.write(bytes);
        out.flush();
    }
}
