package com.tracegate.proxy.core.http;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Writes the HTTP/1.1 chunked transfer coding. Every write becomes one chunk
 * and is flushed, so event streams reach the client as they arrive.
 * {@link #finish()} writes the terminating zero-length chunk but leaves the
 * underlying connection open.
 */
public class ChunkedOutputStream extends FilterOutputStream {

    private static final byte[] CRLF = { '\r', '\n' };
    private boolean finished;

    public ChunkedOutputStream(OutputStream out) {
        super(out);
    }

    @Override
    public void write(int b) throws IOException {
        write(new byte[] { (byte) b }, 0, 1);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        if (finished) {
            throw new IOException("Chunked stream already finished");
        }
        if (len == 0) {
            return;
        }
        out.write(Integer.toHexString(len).getBytes(StandardCharsets.US_ASCII));
        out.write(CRLF);
        out.write(b, off, len);
        out.write(CRLF);
        out.flush();
    }

    /**
     * Writes the last-chunk marker. Idempotent.
     */
    public void finish() throws IOException {
        if (!finished) {
            finished = true;
            out.write('0');
            out.write(CRLF);
            out.write(CRLF);
            out.flush();
        }
    }

    @Override
    public void close() throws IOException {
        // The client socket outlives the response on keep-alive connections.
        finish();
    }
}
