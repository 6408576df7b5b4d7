package com.tracegate.proxy.core.server;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tracegate.proxy.core.utils.NamedThreadFactory;

/**
 * Starts the listeners on their own accept threads and stops them together.
 */
public class ServerManager {

    private static final Logger log = LoggerFactory.getLogger(ServerManager.class);
    private static final long BIND_TIMEOUT_SECONDS = 2;

    private final List<ListeningServer> activeServers = new ArrayList<>();
    private final ExecutorService executor = Executors.newCachedThreadPool(new NamedThreadFactory("accept"));

    /**
     * Starts a server and waits for it to bind.
     * 
     * @param server The server to start.
     * @return True if the server is listening; false if the bind failed or timed
     *         out, in which case the server has been stopped again.
     */
    public synchronized boolean start(ListeningServer server) {
        executor.submit(server::start);
        if (server.awaitBind(BIND_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            activeServers.add(server);
            log.info("Started {} server on port {}", server.getName(), server.getPort());
            return true;
        }
        log.error("{} server failed to bind on port {} within {} s", server.getName(), server.getPort(),
                BIND_TIMEOUT_SECONDS);
        server.stop();
        return false;
    }

    /**
     * @return The servers started so far, in start order.
     */
    public synchronized List<ListeningServer> getActiveServers() {
        return List.copyOf(activeServers);
    }

    /**
     * Stops all servers in reverse start order and shuts down the accept threads.
     */
    public synchronized void stopAll() {
        log.info("Stopping all servers...");
        for (int i = activeServers.size() - 1; i >= 0; i--) {
            ListeningServer server = activeServers.get(i);
            try {
                server.stop();
            } catch (Exception e) {
                log.error("Error stopping {} server: {}", server.getName(), e.getMessage());
            }
        }
        activeServers.clear();
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("ServerManager executor did not terminate cleanly after 5 s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
