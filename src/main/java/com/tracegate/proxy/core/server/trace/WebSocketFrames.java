package com.tracegate.proxy.core.server.trace;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

import com.tracegate.proxy.core.exceptions.ProtocolException;

/**
 * Minimal RFC 6455 framing for the server side of a WebSocket: handshake key
 * derivation, unmasked outbound frames and masked inbound frames.
 */
public final class WebSocketFrames {

    public static final int OPCODE_CONTINUATION = 0x0;
    public static final int OPCODE_TEXT = 0x1;
    public static final int OPCODE_BINARY = 0x2;
    public static final int OPCODE_CLOSE = 0x8;
    public static final int OPCODE_PING = 0x9;
    public static final int OPCODE_PONG = 0xA;

    /** Largest client frame payload accepted. */
    public static final int MAX_INBOUND_PAYLOAD = 64 * 1024;

    private static final String HANDSHAKE_GUID = "258EAFA5-E914-47DA-95CA-C5AB0DC85B11";

    /**
     * A decoded inbound frame.
     *
     * @param fin     Whether this is the final fragment.
     * @param opcode  Frame opcode.
     * @param payload Unmasked payload.
     */
    public record Frame(boolean fin, int opcode, byte[] payload) {
    }

    private WebSocketFrames() {
        // Utility class
    }

    /**
     * Computes the {@code Sec-WebSocket-Accept} value for a client key.
     */
    public static String acceptKey(String clientKey) {
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            byte[] digest = sha1.digest((clientKey.trim() + HANDSHAKE_GUID).getBytes(StandardCharsets.US_ASCII));
            return Base64.getEncoder().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    public static void writeText(OutputStream out, String text) throws IOException {
        writeFrame(out, OPCODE_TEXT, text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Writes a single unfragmented, unmasked frame. Does not flush.
     */
    public static void writeFrame(OutputStream out, int opcode, byte[] payload) throws IOException {
        out.write(0x80 | (opcode & 0x0F));
        int len = payload.length;
        if (len < 126) {
            out.write(len);
        } else if (len <= 0xFFFF) {
            out.write(126);
            out.write((len >>> 8) & 0xFF);
            out.write(len & 0xFF);
        } else {
            out.write(127);
            long l = len;
            for (int shift = 56; shift >= 0; shift -= 8) {
                out.write((int) ((l >>> shift) & 0xFF));
            }
        }
        out.write(payload);
    }

    /**
     * Reads one client frame.
     * 
     * @throws EOFException      If the peer closed the connection.
     * @throws ProtocolException If the frame is unmasked or too large.
     */
    public static Frame readFrame(InputStream in) throws IOException {
        int b0 = readByte(in);
        int b1 = readByte(in);
        boolean fin = (b0 & 0x80) != 0;
        int opcode = b0 & 0x0F;
        boolean masked = (b1 & 0x80) != 0;
        long len = b1 & 0x7F;
        if (len == 126) {
            len = ((long) readByte(in) << 8) | readByte(in);
        } else if (len == 127) {
            len = 0;
            for (int i = 0; i < 8; i++) {
                len = (len << 8) | readByte(in);
            }
        }
        if (!masked) {
            throw new ProtocolException("Client frame is not masked");
        }
        if (len > MAX_INBOUND_PAYLOAD) {
            throw new ProtocolException("Client frame too large: " + len + " bytes");
        }
        byte[] mask = in.readNBytes(4);
        if (mask.length < 4) {
            throw new EOFException("Connection closed inside frame header");
        }
        byte[] payload = in.readNBytes((int) len);
        if (payload.length < len) {
            throw new EOFException("Connection closed inside frame payload");
        }
        for (int i = 0; i < payload.length; i++) {
            payload[i] ^= mask[i & 3];
        }
        return new Frame(fin, opcode, payload);
    }

    private static int readByte(InputStream in) throws IOException {
        int b = in.read();
        if (b < 0) {
            throw new EOFException("Connection closed");
        }
        return b;
    }
}
