package com.tracegate.proxy.core.server.trace;

import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tracegate.proxy.core.trace.Trace;
import com.tracegate.proxy.core.trace.TraceObserver;
import com.tracegate.proxy.core.utils.IoUtils;
import com.tracegate.proxy.core.utils.JsonSupport;

/**
 * Trace observer backed by an upgraded WebSocket connection. Each trace is sent
 * as one JSON text frame.
 * <p>
 * Writes come from the hub's writer thread (traces) and from the connection's reader
 * thread (pong and close replies), so all frame writes are synchronized.
 * </p>
 */
public class WebSocketObserver implements TraceObserver {

    private static final Logger log = LoggerFactory.getLogger(WebSocketObserver.class);

    private final Socket socket;
    private final OutputStream out;
    private final String remoteAddr;
    private final AtomicBoolean closed = new AtomicBoolean();

    public WebSocketObserver(Socket socket, OutputStream out) {
        this.socket = socket;
        this.out = out;
        this.remoteAddr = socket.getInetAddress().getHostAddress();
    }

    @Override
    public void onTrace(Trace trace) throws IOException {
        sendFrame(WebSocketFrames.OPCODE_TEXT, JsonSupport.toJson(trace).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Answers a ping with a pong carrying the same payload.
     */
    public void pong(byte[] payload) throws IOException {
        sendFrame(WebSocketFrames.OPCODE_PONG, payload);
    }

    /**
     * Echoes a close frame back to the client.
     */
    public void replyClose(byte[] payload) throws IOException {
        sendFrame(WebSocketFrames.OPCODE_CLOSE, payload);
    }

    private synchronized void sendFrame(int opcode, byte[] payload) throws IOException {
        if (closed.get()) {
            throw new IOException("WebSocket to " + remoteAddr + " is closed");
        }
        WebSocketFrames.writeFrame(out, opcode, payload);
        out.flush();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("Closing trace WebSocket to {}", remoteAddr);
            IoUtils.closeQuietly(socket, "trace websocket");
        }
    }
}
