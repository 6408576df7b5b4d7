package com.tracegate.proxy;

import com.tracegate.proxy.config.TracegateProperties;
import com.tracegate.proxy.core.exceptions.ConfigException;
import com.tracegate.proxy.core.exceptions.GatewayException;
import com.tracegate.proxy.core.exceptions.HookLoadException;
import com.tracegate.proxy.core.hook.HookManager;
import com.tracegate.proxy.core.server.ServerManager;
import com.tracegate.proxy.core.server.gateway.GatewayServer;
import com.tracegate.proxy.core.server.gateway.UpstreamClientFactory;
import com.tracegate.proxy.core.server.trace.TraceServer;
import com.tracegate.proxy.core.services.MetricsService;
import com.tracegate.proxy.core.trace.TraceHub;
import io.micrometer.core.instrument.MeterRegistry;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Scanner;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for Tracegate.
 * Handles command-line arguments, configuration loading, hook script watching
 * and application lifecycle.
 */
@Command(name = "tracegate", mixinStandardHelpOptions = true, version = "1.0.0", description = "Scriptable API gateway with live traffic tracing.")
public class TracegateApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TracegateApplication.class);

    /** Script printed by {@code --print-sample-hook}. */
    static final String SAMPLE_HOOK_SCRIPT = """
            function processRequest(body, headers)
                -- Modify the request body and headers here
                return body, headers
            end

            function processResponse(body, headers)
                -- Modify the response body and headers here
                return body, headers
            end
            """;

    @Spec
    private CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "Path to config file (YAML)", defaultValue = "application.yml")
    private String configPath;

    @Option(names = "--host", description = "Host the gateway listens on (overrides gateway.host)")
    private String host;

    @Option(names = { "-p", "--port" }, description = "Port the gateway listens on (overrides gateway.port)")
    private Integer port;

    @Option(names = "--trace-port", description = "Port of the trace server (overrides traces.port)")
    private Integer tracePort;

    @Option(names = "--hook", description = "Lua script defining processRequest and/or processResponse (overrides hooks.script)")
    private String hookScript;

    @Option(names = "--print-sample-hook", description = "Print a sample Lua hook script and exit")
    private boolean printSampleHook;

    private ServerManager serverManager;
    private MetricsService metricsService;
    private TraceHub traceHub;
    private HookManager hookManager;
    private Path hookScriptPath;

    /** Latch to block the main thread until shutdown is triggered. */
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    /** Flag to signal background threads to stop. */
    private final AtomicBoolean running = new AtomicBoolean(true);

    /** Watches the hook script's directory; assigned once during startup. */
    private WatchService watchService;

    /** Reference to the registered shutdown hook for cleanup. */
    private Thread shutdownHook;

    /**
     * Main method to launch the application.
     * 
     * @param args Command-line arguments.
     */
    public static void main(String[] args) {
        System.exit(new CommandLine(new TracegateApplication()).execute(args));
    }

    /**
     * Loads configuration, starts the trace hub and both listeners, then blocks
     * until {@link #stop()}.
     * 
     * @return Exit code (0 for success, 1 for failure).
     */
    @Override
    public Integer call() {
        if (printSampleHook) {
            PrintWriter out = spec.commandLine().getOut();
            out.print(SAMPLE_HOOK_SCRIPT);
            out.flush();
            return 0;
        }
        try {
            log.info("Starting Tracegate...");

            TracegateProperties props = loadConfig(configPath);
            applyOverrides(props);
            props.validate();

            this.metricsService = new MetricsService(props.getAdmin());
            MeterRegistry registry = metricsService.getRegistry();

            this.traceHub = new TraceHub(props.getTraces().getMaxHistory());
            traceHub.bindMetrics(registry);
            traceHub.start();

            this.hookManager = new HookManager(props.getHooks().getTimeoutMillis(), registry);
            this.hookScriptPath = scriptPath(props);
            if (hookScriptPath != null) {
                loadHookScript(hookScriptPath);
                if (props.getHooks().isWatch()) {
                    startHookWatcher(hookScriptPath);
                }
            }

            HttpClient httpClient = UpstreamClientFactory.create(props.getGateway());
            this.serverManager = new ServerManager();
            if (!serverManager.start(new GatewayServer(props.getGateway(), httpClient, hookManager, traceHub, registry))
                    || !serverManager.start(new TraceServer(props.getTraces(), traceHub, registry))) {
                throw new GatewayException("Could not start all listeners");
            }
            log.info("Forwarding {}* to {}", props.getGateway().getPathPrefix(), props.getGateway().getUpstream());

            if (System.getProperty("tracegate.no-command-listener") == null) {
                startCommandListener();
            }

            if (System.getProperty("tracegate.no-shutdown-hook") == null) {
                this.shutdownHook = new Thread(this::stop, "ShutdownHook");
                Runtime.getRuntime().addShutdownHook(shutdownHook);
            }

            shutdownLatch.await();
            return 0;
        } catch (ConfigException e) {
            log.error("Configuration Error: {}", e.getMessage());
            return 1;
        } catch (GatewayException e) {
            log.error("Fatal gateway error: {}", e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            log.warn("Application interrupted");
            Thread.currentThread().interrupt();
            return 0;
        } catch (Exception e) {
            log.error("Unexpected fatal error", e);
            return 1;
        } finally {
            stop();
        }
    }

    /**
     * Applies command-line options on top of the YAML values.
     */
    private void applyOverrides(TracegateProperties props) {
        if (host != null) {
            props.getGateway().setHost(host);
        }
        if (port != null) {
            props.getGateway().setPort(port);
        }
        if (tracePort != null) {
            props.getTraces().setPort(tracePort);
        }
        if (hookScript != null) {
            props.getHooks().setScript(hookScript);
        }
    }

    private static Path scriptPath(TracegateProperties props) {
        String script = props.getHooks().getScript();
        return script == null || script.isBlank() ? null : Path.of(script).toAbsolutePath();
    }

    /**
     * Loads a hook script, keeping the previous one (or none) if it is rejected.
     */
    private void loadHookScript(Path script) {
        try {
            hookManager.load(script);
        } catch (HookLoadException e) {
            log.error("Failed to load Lua hook script ({}): {}", e.getReason(), e.getMessage());
        }
    }

    /**
     * Starts an interactive command listener on System.in.
     */
    private void startCommandListener() {
        Thread listener = new Thread(() -> {
            try (Scanner scanner = new Scanner(System.in, StandardCharsets.UTF_8)) {
                log.info("Interactive console ready. Type 'help' for commands.");
                while (running.get() && readAndProcessCommand(scanner)) {
                    // Loop continues as long as input is available and stop hasn't been signaled
                }
            } catch (Exception e) {
                if (running.get()) {
                    log.warn("Command listener fatal error: {}", e.getMessage(), e);
                }
            }
        }, "CommandListener");
        listener.setDaemon(true);
        listener.start();
    }

    private boolean readAndProcessCommand(Scanner scanner) {
        try {
            if (scanner.hasNextLine()) {
                processCommand(scanner.nextLine().trim().toLowerCase(Locale.ROOT));
                return true;
            }
        } catch (NoSuchElementException e) {
            log.debug("Console input closed");
        }
        return false;
    }

    /**
     * Processes a single interactive command from the console.
     * 
     * @param command The command string.
     */
    void processCommand(String command) {
        if (command.isEmpty()) {
            return;
        }

        switch (command) {
            case "reload" -> reloadHooks();
            case "unload" -> hookManager.unload();
            case "stop", "exit", "quit" -> stop();
            case "help" -> log.info("Available commands: reload, unload, stop, exit, quit, help");
            default -> log.warn("Unknown command: {}. Type 'help' for available commands.", command);
        }
    }

    private void reloadHooks() {
        if (hookScriptPath == null) {
            log.warn("No hook script configured; start with --hook to use reload");
            return;
        }
        log.info("Reloading hook script {}...", hookScriptPath);
        loadHookScript(hookScriptPath);
    }

    /**
     * Gracefully stops the listeners, the trace hub, the hook watcher and the
     * admin server.
     * Also unregisters the shutdown hook to prevent leaks in test environments.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down Tracegate...");

            unregisterShutdownHook();

            if (serverManager != null) {
                serverManager.stopAll();
            }
            if (traceHub != null) {
                traceHub.stop();
            }
            if (metricsService != null) {
                metricsService.shutdown();
            }
            closeWatchService();
            shutdownLatch.countDown();
        }
    }

    private void unregisterShutdownHook() {
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                // Expected when stop() runs from the hook itself
                log.trace("Shutdown already in progress");
            }
        }
    }

    private void closeWatchService() {
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.debug("Error closing watch service: {}", e.getMessage());
            }
        }
    }

    /**
     * Starts a background thread that reloads the hook script when its file
     * changes, debounced by one second.
     */
    private void startHookWatcher(Path script) {
        Path parent = script.getParent();
        if (parent == null) {
            return;
        }
        Thread watcherThread = new Thread(() -> {
            try {
                this.watchService = FileSystems.getDefault().newWatchService();
                parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY,
                        StandardWatchEventKinds.ENTRY_CREATE);

                log.info("Watching hook script for changes: {}", script);
                runWatcherLoop(script);
            } catch (ClosedWatchServiceException e) {
                log.debug("Watch service closed");
            } catch (InterruptedException e) {
                log.debug("Hook watcher interrupted");
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                if (running.get()) {
                    log.warn("Hook watcher error: {}", e.getMessage(), e);
                }
            }
        }, "HookWatcher");
        watcherThread.setDaemon(true);
        watcherThread.start();
    }

    private void runWatcherLoop(Path script) throws InterruptedException {
        final long debounceNanos = 1_000_000_000L;
        String fileName = script.getFileName().toString();
        long lastEventNano = 0;

        while (running.get()) {
            WatchKey key = watchService.poll(500, TimeUnit.MILLISECONDS);
            if (key != null) {
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.context() != null && event.context().toString().equals(fileName)) {
                        lastEventNano = System.nanoTime();
                    }
                }
                if (!key.reset()) {
                    break;
                }
            }

            if (lastEventNano > 0 && System.nanoTime() - lastEventNano >= debounceNanos) {
                lastEventNano = 0;
                log.info("Hook script {} changed, reloading", script);
                loadHookScript(script);
            }
        }
    }

    /**
     * Loads the configuration from a file path, falling back to the classpath.
     * 
     * @param path Path to the configuration file.
     * @return The loaded properties.
     * @throws ConfigException if configuration cannot be loaded.
     */
    static TracegateProperties loadConfig(String path) {
        Yaml yaml = new Yaml(new Constructor(TracegateProperties.class, new LoaderOptions()));

        TracegateProperties fromFile = tryLoadFromFile(yaml, path);
        if (fromFile != null) {
            return fromFile;
        }

        TracegateProperties fromClasspath = tryLoadFromClasspath(yaml, path);
        if (fromClasspath != null) {
            return fromClasspath;
        }

        throw new ConfigException("Configuration file not found: " + path);
    }

    private static TracegateProperties tryLoadFromFile(Yaml yaml, String path) {
        File file = new File(path);
        if (file.exists()) {
            try (InputStream is = new FileInputStream(file)) {
                return orDefaults(yaml.load(is));
            } catch (YAMLException | ClassCastException e) {
                throw new ConfigException("Invalid YAML in " + path + ": " + e.getMessage());
            } catch (IOException e) {
                throw new ConfigException("Error reading config file: " + path, e);
            }
        }
        return null;
    }

    private static TracegateProperties tryLoadFromClasspath(Yaml yaml, String path) {
        try (InputStream is = TracegateApplication.class.getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                return orDefaults(yaml.load(is));
            }
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigException("Invalid YAML in classpath resource " + path + ": " + e.getMessage());
        } catch (IOException e) {
            log.debug("Classpath resource lookup failed for {}", path);
        }
        return null;
    }

    /**
     * An empty YAML document loads as null; treat it as all defaults.
     */
    private static TracegateProperties orDefaults(TracegateProperties loaded) {
        return loaded != null ? loaded : new TracegateProperties();
    }
}
