package com.tracegate.proxy.core.utils;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tracegate.proxy.core.exceptions.ProtocolException;

/**
 * Stream helpers shared by the gateway and trace servers.
 */
public class IoUtils {

    private IoUtils() {
        // Utility class
    }

    private static final Logger log = LoggerFactory.getLogger(IoUtils.class);

    /** Buffer size used when copying streamed bodies. */
    public static final int DEFAULT_BUFFER_SIZE = 8192;

    /** Longest request line or header line accepted. */
    public static final int MAX_LINE_LENGTH = 8192;

    /**
     * Reads a single line of text from an input stream, terminated by CRLF or LF.
     * 
     * @param in The input stream to read from.
     * @return The line read, or null if the end of the stream is reached.
     * @throws IOException If an I/O error occurs or the line exceeds 8 KiB.
     */
    public static String readLine(InputStream in) throws IOException {
        return readLine(in, MAX_LINE_LENGTH);
    }

    /**
     * Reads a single line of text with a maximum length limit. Bytes are decoded
     * as ISO-8859-1, matching the HTTP/1.1 wire encoding.
     * 
     * @param in        The input stream to read from.
     * @param maxLength The maximum allowed length of the line.
     * @return The line read, or null if the end of the stream is reached.
     * @throws IOException If an I/O error occurs or the line exceeds maxLength.
     */
    public static String readLine(InputStream in, int maxLength) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int len = 0;
        int c;
        while ((c = in.read()) != -1) {
            if (c == '\n') {
                break;
            }
            if (c != '\r') {
                if (++len > maxLength) {
                    throw new ProtocolException("Line length exceeds maximum allowed length of " + maxLength);
                }
                buf.write(c);
            }
        }
        if (c == -1 && len == 0) {
            return null;
        }
        return buf.toString(StandardCharsets.ISO_8859_1);
    }

    /**
     * Reads exactly {@code length} bytes.
     * 
     * @throws EOFException If the stream ends early.
     */
    public static byte[] readFixedBody(InputStream in, long length) throws IOException {
        if (length > Integer.MAX_VALUE - 8) {
            throw new ProtocolException("Body too large: " + length);
        }
        byte[] body = in.readNBytes((int) length);
        if (body.length != length) {
            throw new EOFException("Expected " + length + " body bytes, got " + body.length);
        }
        return body;
    }

    /**
     * Reads a body sent with the chunked transfer coding, discarding any chunk
     * extensions and trailer fields.
     * 
     * @param in Stream positioned at the first chunk-size line.
     * @return The de-chunked body.
     * @throws IOException If the stream ends early or a chunk size is invalid.
     */
    public static byte[] readChunkedBody(InputStream in) throws IOException {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        while (true) {
            String sizeLine = readLine(in);
            if (sizeLine == null) {
                throw new EOFException("Unexpected end of chunked body");
            }
            int semi = sizeLine.indexOf(';');
            String hex = (semi >= 0 ? sizeLine.substring(0, semi) : sizeLine).trim();
            int size;
            try {
                size = Integer.parseInt(hex, 16);
            } catch (NumberFormatException e) {
                throw new ProtocolException("Invalid chunk size: " + sizeLine, e);
            }
            if (size < 0) {
                throw new ProtocolException("Invalid chunk size: " + sizeLine);
            }
            if (size == 0) {
                String trailer;
                while ((trailer = readLine(in)) != null && !trailer.isEmpty()) {
                    log.trace("Ignoring chunked trailer: {}", trailer);
                }
                return body.toByteArray();
            }
            body.write(readFixedBody(in, size));
            // CRLF after chunk data
            readLine(in);
        }
    }

    /**
     * Copies a stream to the output, flushing after every read so that partial
     * data reaches the peer immediately.
     * 
     * @return Number of bytes copied.
     */
    public static long copyFlushing(InputStream in, OutputStream out) throws IOException {
        byte[] buffer = new byte[DEFAULT_BUFFER_SIZE];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) >= 0) {
            if (read > 0) {
                out.write(buffer, 0, read);
                out.flush();
                total += read;
            }
        }
        return total;
    }

    /**
     * Safely closes a resource without throwing exceptions.
     * 
     * @param closeable The resource to close.
     */
    public static void closeQuietly(AutoCloseable closeable) {
        closeQuietly(closeable, "resource");
    }

    /**
     * Safely closes a resource, logging any exceptions.
     * 
     * @param closeable The resource to close.
     * @param name      Name of the resource for logging.
     */
    public static void closeQuietly(AutoCloseable closeable, String name) {
        if (closeable != null) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.debug("Error closing {}: {}", name, e.getMessage());
            }
        }
    }
}
