package com.tracegate.proxy;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.tracegate.proxy.config.TracegateProperties;
import com.tracegate.proxy.core.exceptions.ConfigException;
import com.tracegate.proxy.core.utils.JsonSupport;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class TracegateApplicationTest {

    @TempDir
    Path tempDir;

    @BeforeAll
    static void disableInteractiveHooks() {
        System.setProperty("tracegate.no-command-listener", "true");
        System.setProperty("tracegate.no-shutdown-hook", "true");
    }

    @AfterAll
    static void restoreProperties() {
        System.clearProperty("tracegate.no-command-listener");
        System.clearProperty("tracegate.no-shutdown-hook");
    }

    private static int freePort() throws IOException {
        try (ServerSocket s = new ServerSocket(0)) {
            return s.getLocalPort();
        }
    }

    private static boolean isListening(int port) {
        try (Socket s = new Socket("localhost", port)) {
            return s.isConnected();
        } catch (IOException e) {
            return false;
        }
    }

    private Path writeConfig(String upstream, int gatewayPort, int tracePort) throws IOException {
        String yaml = "gateway:\n"
                + "  host: localhost\n"
                + "  port: " + gatewayPort + "\n"
                + "  upstream: " + upstream + "\n"
                + "traces:\n"
                + "  bindAddress: localhost\n"
                + "  port: " + tracePort + "\n"
                + "hooks:\n"
                + "  watch: false\n"
                + "admin:\n"
                + "  enabled: false\n";
        Path configFile = tempDir.resolve("tracegate.yml");
        Files.writeString(configFile, yaml);
        return configFile;
    }

    @Test
    void main_withHelpOption_returnsZero() {
        int exitCode = new CommandLine(new TracegateApplication()).execute("--help");
        assertThat(exitCode).isZero();
    }

    @Test
    void main_withVersionOption_returnsZero() {
        int exitCode = new CommandLine(new TracegateApplication()).execute("--version");
        assertThat(exitCode).isZero();
    }

    @Test
    void printSampleHook_writesScriptAndExits() {
        StringWriter sw = new StringWriter();
        CommandLine cmd = new CommandLine(new TracegateApplication());
        cmd.setOut(new PrintWriter(sw));

        int exitCode = cmd.execute("--print-sample-hook");

        assertThat(exitCode).isZero();
        assertThat(sw.toString())
                .isEqualTo(TracegateApplication.SAMPLE_HOOK_SCRIPT)
                .contains("function processRequest(body, headers)")
                .contains("function processResponse(body, headers)");
    }

    @Test
    void call_withInvalidConfig_returnsError() throws Exception {
        Path configFile = tempDir.resolve("bad.yml");
        Files.writeString(configFile, "invalid yaml content: !!!");

        int exitCode = new CommandLine(new TracegateApplication()).execute("-c", configFile.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void call_withOutOfRangePort_returnsError() throws Exception {
        Path configFile = writeConfig("http://localhost:1", 70000, freePort());

        int exitCode = new CommandLine(new TracegateApplication()).execute("-c", configFile.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void loadConfig_readsBundledDefaults() {
        TracegateProperties props = TracegateApplication.loadConfig("application.yml");

        assertThat(props.getGateway().getPort()).isEqualTo(8080);
        assertThat(props.getGateway().getPathPrefix()).isEqualTo("/v1/");
        assertThat(props.getTraces().getPort()).isEqualTo(8081);
        assertThat(props.getAdmin().getBindAddress()).isEqualTo("127.0.0.1");
    }

    @Test
    void loadConfig_emptyFileGivesDefaults() throws Exception {
        Path empty = tempDir.resolve("empty.yml");
        Files.writeString(empty, "");

        TracegateProperties props = TracegateApplication.loadConfig(empty.toString());

        assertThat(props.getGateway().getUpstream()).isEqualTo("https://api.openai.com");
    }

    @Test
    void loadConfig_missingFile_throws() {
        assertThatThrownBy(() -> TracegateApplication.loadConfig(tempDir.resolve("nope.yml").toString()))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void call_withValidConfig_startsServers() throws Exception {
        int gatewayPort = freePort();
        int tracePort = freePort();
        Path configFile = writeConfig("http://localhost:1", gatewayPort, tracePort);

        TracegateApplication app = new TracegateApplication();
        CommandLine cmd = new CommandLine(app);
        Thread appThread = new Thread(() -> cmd.execute("-c", configFile.toString()));
        appThread.setDaemon(true);
        appThread.start();

        await().atMost(Duration.ofSeconds(10)).until(() -> isListening(gatewayPort) && isListening(tracePort));

        app.stop();

        await().atMost(Duration.ofSeconds(10)).until(() -> !appThread.isAlive());
        assertThat(isListening(gatewayPort)).isFalse();
    }

    @Test
    void endToEnd_hookReloadAndTraceDump() throws Exception {
        WireMockServer upstream = new WireMockServer(wireMockConfig().dynamicPort());
        upstream.start();
        TracegateApplication app = new TracegateApplication();
        Thread appThread = null;
        try {
            upstream.stubFor(get(urlEqualTo("/v1/models")).willReturn(aResponse()
                    .withHeader("Content-Type", "application/json")
                    .withBody("{\"data\":[]}")));
            int gatewayPort = freePort();
            int tracePort = freePort();
            Path configFile = writeConfig(upstream.baseUrl(), gatewayPort, tracePort);
            Path hook = tempDir.resolve("hook.lua");
            Files.writeString(hook, "function processResponse(body, headers)\n"
                    + "  headers['x-version'] = {'1'}\n  return body, headers\nend\n", StandardCharsets.UTF_8);

            CommandLine cmd = new CommandLine(app);
            appThread = new Thread(() -> cmd.execute("-c", configFile.toString(), "--hook", hook.toString()));
            appThread.setDaemon(true);
            appThread.start();
            await().atMost(Duration.ofSeconds(10)).until(() -> isListening(gatewayPort) && isListening(tracePort));

            HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
            HttpRequest models = HttpRequest.newBuilder(URI.create("http://localhost:" + gatewayPort + "/v1/models"))
                    .GET().build();

            HttpResponse<String> first = client.send(models, HttpResponse.BodyHandlers.ofString());
            assertThat(first.headers().firstValue("x-version")).hasValue("1");

            Files.writeString(hook, "function processResponse(body, headers)\n"
                    + "  headers['x-version'] = {'2'}\n  return body, headers\nend\n", StandardCharsets.UTF_8);
            app.processCommand("reload");
            HttpResponse<String> second = client.send(models, HttpResponse.BodyHandlers.ofString());
            assertThat(second.headers().firstValue("x-version")).hasValue("2");

            app.processCommand("unload");
            HttpResponse<String> third = client.send(models, HttpResponse.BodyHandlers.ofString());
            assertThat(third.headers().firstValue("x-version")).isEmpty();

            HttpRequest traces = HttpRequest.newBuilder(URI.create("http://localhost:" + tracePort + "/traces"))
                    .GET().build();
            await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
                String dump = client.send(traces, HttpResponse.BodyHandlers.ofString()).body();
                assertThat(JsonSupport.mapper().readTree(dump)).hasSize(3);
            });
            assertThat(upstream.getAllServeEvents()).hasSize(3);
        } finally {
            app.stop();
            if (appThread != null) {
                Thread t = appThread;
                await().atMost(Duration.ofSeconds(10)).until(() -> !t.isAlive());
            }
            upstream.stop();
        }
    }
}
