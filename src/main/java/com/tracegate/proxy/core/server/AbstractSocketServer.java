package com.tracegate.proxy.core.server;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tracegate.proxy.core.utils.IoUtils;
import com.tracegate.proxy.core.utils.NamedThreadFactory;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Base class for the gateway and trace listeners.
 * <p>
 * Accepts connections on one thread and hands each client to a pooled worker
 * thread, bounded by a semaphore of {@code maxConnections}. Connections over
 * the limit are closed immediately.
 * </p>
 */
public abstract class AbstractSocketServer implements ListeningServer {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    /** Micrometer registry for metrics. */
    protected final MeterRegistry registry;

    /** Worker pool running one task per client connection. */
    protected final ExecutorService executor;

    /** Set of active client sockets for graceful shutdown. */
    protected final Set<Socket> activeSockets = ConcurrentHashMap.newKeySet();

    /** The listening socket. */
    protected ServerSocket serverSocket;

    private final String name;
    private final String bindAddress;
    private final int port;
    private final int maxConnections;
    private final int socketTimeoutMillis;
    private final Semaphore connectionSemaphore;

    private final Counter totalConnections;
    private final Counter connectionErrors;
    private final Meter activeGauge;

    /** Released once the bind attempt has finished, successfully or not. */
    private final CountDownLatch bindLatch = new CountDownLatch(1);
    private volatile boolean bindSuccess = false;

    /**
     * @param name                Listener name for logs, threads and metric tags.
     * @param bindAddress         Host or address to bind; null binds all
     *                            interfaces.
     * @param port                Port to bind; 0 picks a free port.
     * @param maxConnections      Concurrent connection limit.
     * @param socketTimeoutMillis Read timeout on client sockets; 0 disables it.
     * @param registry            The Micrometer meter registry.
     */
    protected AbstractSocketServer(String name, String bindAddress, int port, int maxConnections,
            int socketTimeoutMillis, MeterRegistry registry) {
        this.name = name;
        this.bindAddress = bindAddress;
        this.port = port;
        this.maxConnections = maxConnections;
        this.socketTimeoutMillis = socketTimeoutMillis;
        this.registry = registry;
        this.connectionSemaphore = new Semaphore(maxConnections);
        this.executor = Executors.newCachedThreadPool(new NamedThreadFactory(name.toLowerCase(Locale.ROOT) + "-worker"));

        String tag = name.toLowerCase(Locale.ROOT);
        this.totalConnections = Counter.builder("server.connections.total")
                .tag("server", tag)
                .description("Total number of accepted connections")
                .register(registry);
        this.connectionErrors = Counter.builder("server.connections.errors")
                .tag("server", tag)
                .description("Total number of connection errors")
                .register(registry);
        this.activeGauge = Gauge.builder("server.connections.active", activeSockets, Set::size)
                .tag("server", tag)
                .description("Current number of active connections")
                .register(registry);
    }

    /**
     * Binds to the configured address and enters the accept loop.
     */
    @Override
    public void start() {
        try {
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            InetSocketAddress bindAddr = bindAddress != null
                    ? new InetSocketAddress(bindAddress, port)
                    : new InetSocketAddress(port);
            serverSocket.bind(bindAddr);
            bindSuccess = true;
            bindLatch.countDown();
            log.info("{} server listening on {}:{}", name, bindAddress != null ? bindAddress : "0.0.0.0",
                    serverSocket.getLocalPort());

            while (!serverSocket.isClosed()) {
                if (!acceptNextClient()) {
                    break;
                }
            }
        } catch (IOException e) {
            bindLatch.countDown();
            connectionErrors.increment();
            log.error("{} server error on port {}: {}", name, port, e.getMessage(), e);
        }
    }

    private boolean acceptNextClient() {
        try {
            Socket client = serverSocket.accept();
            processClient(client);
            return true;
        } catch (SocketException e) {
            if (serverSocket.isClosed()) {
                return false;
            }
            connectionErrors.increment();
            log.error("{} accept error on port {}: {}", name, getPort(), e.getMessage());
            return true;
        } catch (IOException e) {
            connectionErrors.increment();
            log.error("{} I/O error during accept on port {}: {}", name, getPort(), e.getMessage());
            return true;
        }
    }

    @Override
    public boolean awaitBind(long timeout, TimeUnit unit) {
        try {
            return bindLatch.await(timeout, unit) && bindSuccess;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void processClient(Socket client) {
        String remoteAddr = client.getInetAddress().getHostAddress();
        totalConnections.increment();
        try {
            client.setTcpNoDelay(true);
            if (socketTimeoutMillis > 0) {
                client.setSoTimeout(socketTimeoutMillis);
            }
        } catch (SocketException e) {
            log.debug("{} failed to configure client socket: {}", name, e.getMessage());
        }

        if (connectionSemaphore.tryAcquire()) {
            activeSockets.add(client);
            executor.submit(() -> {
                try {
                    handleClient(client);
                } catch (Exception e) {
                    connectionErrors.increment();
                    log.error("{} unexpected error handling client {}: {}", name, remoteAddr, e.getMessage(), e);
                } finally {
                    activeSockets.remove(client);
                    connectionSemaphore.release();
                    IoUtils.closeQuietly(client, "client socket");
                }
            });
        } else {
            log.warn("{} connection limit reached ({})", name, maxConnections);
            IoUtils.closeQuietly(client, "limit reached client socket");
        }
    }

    /**
     * Closes the listening socket and every active client connection.
     */
    @Override
    public void stop() {
        log.info("Stopping {} server on port {}...", name, getPort());
        try {
            if (serverSocket != null) {
                serverSocket.close();
            }
        } catch (IOException e) {
            log.error("{} failed to close server socket: {}", name, e.getMessage(), e);
        }

        for (Socket s : activeSockets) {
            IoUtils.closeQuietly(s);
        }
        activeSockets.clear();

        registry.remove(totalConnections);
        registry.remove(connectionErrors);
        registry.remove(activeGauge);

        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("{} executor did not terminate cleanly after 5 s", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getPort() {
        ServerSocket s = serverSocket;
        return s != null && s.isBound() ? s.getLocalPort() : port;
    }

    /**
     * Handles one accepted client connection on a worker thread. The socket is
     * closed by the caller afterwards.
     * 
     * @param client The accepted client socket.
     */
    protected abstract void handleClient(Socket client);
}
