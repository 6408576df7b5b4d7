package com.tracegate.proxy.core.server;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class ServerManagerTest {

    private final ServerManager manager = new ServerManager();

    /**
     * Writes a fixed greeting to every client.
     */
    static final class GreetingServer extends AbstractSocketServer {
        GreetingServer(int port) {
            super("Greeting", "localhost", port, 2, 1000, new SimpleMeterRegistry());
        }

        @Override
        protected void handleClient(Socket client) {
            try {
                OutputStream out = client.getOutputStream();
                out.write("hello\n".getBytes(StandardCharsets.US_ASCII));
                out.flush();
            } catch (IOException e) {
                log.debug("write failed: {}", e.getMessage());
            }
        }
    }

    @AfterEach
    void tearDown() {
        manager.stopAll();
    }

    @Test
    void start_bindsAndServes() throws Exception {
        GreetingServer server = new GreetingServer(0);

        assertThat(manager.start(server)).isTrue();
        assertThat(server.getPort()).isPositive();
        assertThat(manager.getActiveServers()).containsExactly(server);

        try (Socket s = new Socket("localhost", server.getPort())) {
            s.setSoTimeout(5000);
            assertThat(new String(s.getInputStream().readNBytes(6), StandardCharsets.US_ASCII)).isEqualTo("hello\n");
        }
    }

    @Test
    void start_portInUse_returnsFalse() throws Exception {
        try (ServerSocket occupied = new ServerSocket(0)) {
            GreetingServer server = new GreetingServer(occupied.getLocalPort());

            assertThat(manager.start(server)).isFalse();
            assertThat(manager.getActiveServers()).isEmpty();
        }
    }

    @Test
    void stopAll_closesListeners() throws Exception {
        GreetingServer server = new GreetingServer(0);
        manager.start(server);
        int port = server.getPort();

        manager.stopAll();

        assertThat(manager.getActiveServers()).isEmpty();
        await().atMost(Duration.ofSeconds(10)).until(() -> {
            try (Socket s = new Socket("localhost", port)) {
                return false;
            } catch (IOException e) {
                return true;
            }
        });
    }
}
