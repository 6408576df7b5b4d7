package com.tracegate.proxy.core.server.gateway;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseModeTest {

    @Test
    void eventStreamAndPlainText_areStreamed() {
        assertThat(ResponseMode.classify("text/event-stream")).isEqualTo(ResponseMode.STREAM);
        assertThat(ResponseMode.classify("text/event-stream; charset=utf-8")).isEqualTo(ResponseMode.STREAM);
        assertThat(ResponseMode.classify("Text/Plain")).isEqualTo(ResponseMode.STREAM);
    }

    @Test
    void everythingElse_isBuffered() {
        assertThat(ResponseMode.classify("application/json")).isEqualTo(ResponseMode.BUFFER);
        assertThat(ResponseMode.classify("text/html")).isEqualTo(ResponseMode.BUFFER);
        assertThat(ResponseMode.classify(null)).isEqualTo(ResponseMode.BUFFER);
    }
}
