package com.tracegate.proxy.core.http;

import com.tracegate.proxy.core.utils.IoUtils;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ChunkedOutputStreamTest {

    @Test
    void writesChunksAndTerminator() throws Exception {
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        try (ChunkedOutputStream out = new ChunkedOutputStream(sink)) {
            out.write("data: a\n\n".getBytes(StandardCharsets.US_ASCII));
            out.write(new byte[0]);
            out.write("data: [DONE]\n\n".getBytes(StandardCharsets.US_ASCII));
        }

        assertThat(sink.toString(StandardCharsets.US_ASCII))
                .isEqualTo("9\r\ndata: a\n\n\r\ne\r\ndata: [DONE]\n\n\r\n0\r\n\r\n");
    }

    @Test
    void outputIsReadableAsChunkedBody() throws Exception {
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        ChunkedOutputStream out = new ChunkedOutputStream(sink);
        out.write("hello ".getBytes(StandardCharsets.US_ASCII));
        out.write("world".getBytes(StandardCharsets.US_ASCII));
        out.finish();
        out.finish();

        byte[] body = IoUtils.readChunkedBody(new ByteArrayInputStream(sink.toByteArray()));
        assertThat(new String(body, StandardCharsets.US_ASCII)).isEqualTo("hello world");
    }
}
