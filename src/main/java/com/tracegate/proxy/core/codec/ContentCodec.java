package com.tracegate.proxy.core.codec;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;

import org.brotli.dec.BrotliInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes HTTP content codings so that hooks see plain response bodies.
 * <p>
 * Supported tokens are {@code gzip}, {@code x-gzip}, {@code deflate} and
 * {@code br}. {@code identity}, unknown tokens and empty values leave the body
 * untouched. A list such as {@code "deflate, gzip"} is undone in reverse order
 * of application.
 * </p>
 */
public final class ContentCodec {

    private static final Logger log = LoggerFactory.getLogger(ContentCodec.class);

    private ContentCodec() {
        // Utility class
    }

    /**
     * Decompresses a body according to its Content-Encoding header value.
     * 
     * @param body     Encoded body bytes.
     * @param encoding Content-Encoding value; may be null.
     * @return The decoded body, or the input itself when nothing applies.
     * @throws IOException If the data is corrupt for a recognised coding.
     */
    public static byte[] decompress(byte[] body, String encoding) throws IOException {
        if (body == null || body.length == 0 || encoding == null || encoding.isBlank()) {
            return body;
        }
        String[] codings = encoding.split(",");
        byte[] current = body;
        for (int i = codings.length - 1; i >= 0; i--) {
            current = decodeOne(current, codings[i].trim().toLowerCase(Locale.ROOT));
        }
        return current;
    }

    /**
     * @return True if at least one token of the header names a coding this class
     *         can undo.
     */
    public static boolean isSupported(String encoding) {
        if (encoding == null) {
            return false;
        }
        for (String token : encoding.split(",")) {
            switch (token.trim().toLowerCase(Locale.ROOT)) {
                case "gzip", "x-gzip", "deflate", "br":
                    return true;
                default:
                    break;
            }
        }
        return false;
    }

    private static byte[] decodeOne(byte[] data, String coding) throws IOException {
        switch (coding) {
            case "gzip", "x-gzip":
                return readAll(new GZIPInputStream(new ByteArrayInputStream(data)));
            case "br":
                return readAll(new BrotliInputStream(new ByteArrayInputStream(data)));
            case "deflate":
                return inflate(data);
            case "identity", "":
                return data;
            default:
                log.debug("Unknown content coding '{}', leaving body as-is", coding);
                return data;
        }
    }

    private static byte[] inflate(byte[] data) throws IOException {
        try {
            return inflate(data, false);
        } catch (IOException e) {
            // Some servers send raw DEFLATE without the zlib wrapper
            log.debug("zlib inflate failed ({}), retrying as raw deflate", e.getMessage());
            return inflate(data, true);
        }
    }

    private static byte[] inflate(byte[] data, boolean nowrap) throws IOException {
        Inflater inflater = new Inflater(nowrap);
        try {
            return readAll(new InflaterInputStream(new ByteArrayInputStream(data), inflater));
        } finally {
            inflater.end();
        }
    }

    private static byte[] readAll(InputStream in) throws IOException {
        try (in) {
            return in.readAllBytes();
        }
    }
}
