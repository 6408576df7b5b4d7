package com.tracegate.proxy.core.server.trace;

import com.fasterxml.jackson.databind.JsonNode;
import com.tracegate.proxy.config.TraceConfig;
import com.tracegate.proxy.core.trace.Trace;
import com.tracegate.proxy.core.trace.TraceHub;
import com.tracegate.proxy.core.utils.IoUtils;
import com.tracegate.proxy.core.utils.JsonSupport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedInputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class TraceServerTest {

    private TraceHub hub;
    private TraceServer server;
    private HttpClient client;
    private int port;

    @BeforeEach
    void setUp() {
        hub = new TraceHub(100);
        hub.start();
        TraceConfig config = new TraceConfig();
        config.setBindAddress("localhost");
        config.setPort(0);
        server = new TraceServer(config, hub, new SimpleMeterRegistry());
        Thread t = new Thread(server::start);
        t.setDaemon(true);
        t.start();
        assertThat(server.awaitBind(10, TimeUnit.SECONDS)).isTrue();
        port = server.getPort();
        client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        hub.stop();
    }

    private static Trace trace(String id) {
        return new Trace(id, Instant.now(), "POST", "https://api.openai.com/v1/chat/completions", "200 OK", 0.5,
                null, null, "{}", "{\"ok\":true}");
    }

    private static final class CollectingListener implements WebSocket.Listener {
        final List<String> messages = new CopyOnWriteArrayList<>();
        private final StringBuilder partial = new StringBuilder();
        volatile boolean closed;

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                messages.add(partial.toString());
                partial.setLength(0);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            closed = true;
            return null;
        }

        List<String> ids() throws Exception {
            List<String> ids = new CopyOnWriteArrayList<>();
            for (String message : messages) {
                ids.add(JsonSupport.mapper().readTree(message).get("id").asText());
            }
            return ids;
        }
    }

    @Test
    void tracesEndpoint_returnsHistoryAsJson() throws Exception {
        hub.publish(trace("aaaaaaaaaaaaaaaa"));
        hub.publish(trace("bbbbbbbbbbbbbbbb"));
        await().atMost(Duration.ofSeconds(10)).until(() -> hub.history().size() == 2);

        HttpResponse<String> response = client.send(
                HttpRequest.newBuilder(URI.create("http://localhost:" + port + TraceServer.TRACES_PATH)).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).hasValue("application/json");
        JsonNode json = JsonSupport.mapper().readTree(response.body());
        assertThat(json.isArray()).isTrue();
        assertThat(json).hasSize(2);
        assertThat(json.get(0).get("id").asText()).isEqualTo("aaaaaaaaaaaaaaaa");
        assertThat(json.get(1).get("response_body").asText()).isEqualTo("{\"ok\":true}");
    }

    @Test
    void tracesEndpoint_emptyHistory() throws Exception {
        HttpResponse<String> response = client.send(
                HttpRequest.newBuilder(URI.create("http://localhost:" + port + "/traces")).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(response.body()).isEqualTo("[]");
    }

    @Test
    void webSocket_replaysHistoryThenStreamsLiveTraces() throws Exception {
        hub.publish(trace("0000000000000001"));
        hub.publish(trace("0000000000000002"));
        await().atMost(Duration.ofSeconds(10)).until(() -> hub.history().size() == 2);

        CollectingListener listener = new CollectingListener();
        WebSocket ws = client.newWebSocketBuilder()
                .buildAsync(URI.create("ws://localhost:" + port + TraceServer.WEBSOCKET_PATH), listener)
                .get(10, TimeUnit.SECONDS);

        await().atMost(Duration.ofSeconds(10)).until(() -> listener.messages.size() == 2);
        await().atMost(Duration.ofSeconds(10)).until(() -> hub.observerCount() == 1);
        hub.publish(trace("0000000000000003"));

        await().atMost(Duration.ofSeconds(10)).until(() -> listener.messages.size() == 3);
        assertThat(listener.ids()).containsExactly("0000000000000001", "0000000000000002", "0000000000000003");

        ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(10, TimeUnit.SECONDS);
        await().atMost(Duration.ofSeconds(10)).until(() -> listener.closed && hub.observerCount() == 0);
    }

    @Test
    void webSocket_answersPing() throws Exception {
        try (Socket socket = new Socket("localhost", port)) {
            socket.setSoTimeout(10000);
            OutputStream out = socket.getOutputStream();
            InputStream in = new BufferedInputStream(socket.getInputStream());
            out.write(("GET /ws HTTP/1.1\r\nHost: localhost\r\nUpgrade: websocket\r\nConnection: Upgrade\r\n"
                    + "Sec-WebSocket-Key: dGhlIHNhbXBsZSBub25jZQ==\r\nSec-WebSocket-Version: 13\r\n\r\n")
                    .getBytes(StandardCharsets.US_ASCII));
            out.flush();

            assertThat(IoUtils.readLine(in)).isEqualTo("HTTP/1.1 101 Switching Protocols");
            String line;
            boolean acceptSeen = false;
            while (!(line = IoUtils.readLine(in)).isEmpty()) {
                if (line.equalsIgnoreCase("Sec-WebSocket-Accept: s3pPLMBiTxaQ9kYGzzhZRbK+xOo=")) {
                    acceptSeen = true;
                }
            }
            assertThat(acceptSeen).isTrue();

            out.write(WebSocketFramesTest.maskedFrame(WebSocketFrames.OPCODE_PING,
                    "hello".getBytes(StandardCharsets.US_ASCII)));
            out.flush();

            int b0 = in.read();
            int len = in.read();
            byte[] payload = in.readNBytes(len);
            assertThat(b0).isEqualTo(0x80 | WebSocketFrames.OPCODE_PONG);
            assertThat(new String(payload, StandardCharsets.US_ASCII)).isEqualTo("hello");
        }
    }

    @Test
    void webSocketPath_withoutUpgrade_isBadRequest() throws Exception {
        HttpResponse<String> response = client.send(
                HttpRequest.newBuilder(URI.create("http://localhost:" + port + "/ws")).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(400);
    }

    @Test
    void unknownPathAndMethod_areRejected() throws Exception {
        HttpResponse<String> notFound = client.send(
                HttpRequest.newBuilder(URI.create("http://localhost:" + port + "/nope")).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        HttpResponse<String> notAllowed = client.send(
                HttpRequest.newBuilder(URI.create("http://localhost:" + port + "/traces"))
                        .POST(HttpRequest.BodyPublishers.ofString("x")).build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(notFound.statusCode()).isEqualTo(404);
        assertThat(notAllowed.statusCode()).isEqualTo(405);
    }
}
